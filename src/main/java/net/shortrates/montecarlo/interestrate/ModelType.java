package net.shortrates.montecarlo.interestrate;

/**
 * The short rate model variants.
 */
public enum ModelType {
	MERTON,
	VASICEK,
	DOTHAN,
	BRENNAN_SCHWARTZ,
	CIR,
	TWO_FACTOR_GAUSSIAN,
	HULL_WHITE;

	/**
	 * Parses a model name, case insensitive, allowing '-' and ' ' as separators.
	 *
	 * @param name The model name, e.g. <code>"Brennan-Schwartz"</code> or <code>"hull_white"</code>.
	 * @return The model type.
	 */
	public static ModelType of(String name) {
		if(name == null) throw new IllegalArgumentException("Model type must not be null.");
		String normalizedName = name.trim().toUpperCase().replace('-', '_').replace(' ', '_');
		for(ModelType modelType : values()) {
			if(modelType.name().equals(normalizedName)) return modelType;
		}
		throw new IllegalArgumentException("Model type " + name + " not supported.");
	}
}
