package net.shortrates.montecarlo.interestrate.models;

import java.util.Arrays;

import net.shortrates.montecarlo.interestrate.ShortRateModelInterface;

/**
 * Base class of the short rate models, holding the initial state and providing the
 * parameter checks shared by all variants.
 */
public abstract class AbstractShortRateModel implements ShortRateModelInterface {

	private final double[] initialState;

	protected AbstractShortRateModel(double[] initialState) {
		for(int i=0; i<initialState.length; i++) {
			requireFinite("initial state[" + i + "]", initialState[i]);
		}
		this.initialState = initialState.clone();
	}

	@Override
	public double[] getInitialState() {
		return initialState.clone();
	}

	/**
	 * Checks that a given parameter vector has the arity of this model.
	 *
	 * @param parameters The parameter vector.
	 */
	protected void checkNumberOfParameters(double[] parameters) {
		int expectedNumberOfParameters = getParameter().length;
		if(parameters == null || parameters.length != expectedNumberOfParameters) {
			throw new IllegalArgumentException(getModelType() + " model requires " + expectedNumberOfParameters + " parameters, got "
					+ (parameters == null ? "null" : parameters.length) + ".");
		}
	}

	protected static double requireFinite(String name, double value) {
		if(Double.isNaN(value) || Double.isInfinite(value)) {
			throw new IllegalArgumentException("Parameter " + name + " must be finite: " + value + ".");
		}
		return value;
	}

	protected static double requireNonNegative(String name, double value) {
		requireFinite(name, value);
		if(value < 0) {
			throw new IllegalArgumentException("Parameter " + name + " must be non-negative: " + value + ".");
		}
		return value;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + " [initialState=" + Arrays.toString(initialState)
				+ ", parameter=" + Arrays.toString(getParameter()) + "]";
	}
}
