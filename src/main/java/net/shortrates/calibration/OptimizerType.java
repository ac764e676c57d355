package net.shortrates.calibration;

/**
 * The optimization algorithms available for calibration.
 */
public enum OptimizerType {
	/** Derivative free Nelder-Mead simplex search (commons-math). */
	NELDER_MEAD,
	/** Derivative free multi-directional simplex search (commons-math). */
	MULTI_DIRECTIONAL,
	/** Levenberg-Marquardt least squares fit with finite difference derivatives (finmath). */
	LEVENBERG_MARQUARDT;

	public static OptimizerType of(String name) {
		if(name == null) {
			throw new IllegalArgumentException("Optimizer type must not be null.");
		}
		String normalizedName = name.trim().toUpperCase().replace('-', '_').replace(' ', '_');
		for(OptimizerType optimizerType : values()) {
			if(optimizerType.name().equals(normalizedName)) return optimizerType;
		}
		throw new IllegalArgumentException("Optimizer type " + name + " not supported.");
	}
}
