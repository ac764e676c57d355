package net.shortrates.configuration;

import java.util.Map;

/**
 * Typed access to the values of a properties map. Values may be given as numbers, as arrays or as
 * strings (e.g. when read from a <code>.properties</code> file). Arrays may be given as comma separated strings.
 */
public class PropertyValues {

	private PropertyValues() {
	}

	public static boolean contains(Map<String, ?> properties, String key) {
		return properties != null && properties.containsKey(key) && properties.get(key) != null;
	}

	public static double getDouble(Map<String, ?> properties, String key, double defaultValue) {
		return contains(properties, key) ? getDouble(properties, key) : defaultValue;
	}

	public static double getDouble(Map<String, ?> properties, String key) {
		Object value = require(properties, key);
		if(value instanceof Number) return ((Number)value).doubleValue();
		try {
			return Double.parseDouble(value.toString().trim());
		}
		catch(NumberFormatException e) {
			throw new IllegalArgumentException("Property " + key + " must be a number: " + value + ".", e);
		}
	}

	public static int getInteger(Map<String, ?> properties, String key, int defaultValue) {
		if(!contains(properties, key)) return defaultValue;
		Object value = properties.get(key);
		if(value instanceof Number) {
			double doubleValue = ((Number)value).doubleValue();
			if(doubleValue != Math.rint(doubleValue) || doubleValue < Integer.MIN_VALUE || doubleValue > Integer.MAX_VALUE) {
				throw new IllegalArgumentException("Property " + key + " must be an integer: " + value + ".");
			}
			return ((Number)value).intValue();
		}
		try {
			return Integer.parseInt(value.toString().trim());
		}
		catch(NumberFormatException e) {
			throw new IllegalArgumentException("Property " + key + " must be an integer: " + value + ".", e);
		}
	}

	public static String getString(Map<String, ?> properties, String key, String defaultValue) {
		return contains(properties, key) ? properties.get(key).toString().trim() : defaultValue;
	}

	/**
	 * Returns a vector valued property. A scalar value is returned as an array of length 1.
	 *
	 * @param properties The properties.
	 * @param key The key.
	 * @return The values.
	 */
	public static double[] getDoubleArray(Map<String, ?> properties, String key) {
		Object value = require(properties, key);
		if(value instanceof double[]) return ((double[])value).clone();
		if(value instanceof Number) return new double[] { ((Number)value).doubleValue() };
		if(value instanceof Number[]) {
			Number[] numbers = (Number[])value;
			double[] values = new double[numbers.length];
			for(int i = 0; i < numbers.length; i++) values[i] = numbers[i].doubleValue();
			return values;
		}
		String[] fields = value.toString().trim().split("\\s*,\\s*");
		double[] values = new double[fields.length];
		for(int i = 0; i < fields.length; i++) {
			try {
				values[i] = Double.parseDouble(fields[i]);
			}
			catch(NumberFormatException e) {
				throw new IllegalArgumentException("Property " + key + " must be a number or a comma separated list of numbers: " + value + ".", e);
			}
		}
		return values;
	}

	private static Object require(Map<String, ?> properties, String key) {
		if(!contains(properties, key)) {
			throw new IllegalArgumentException("Property " + key + " is required.");
		}
		return properties.get(key);
	}
}
