package net.shortrates.montecarlo.interestrate;

/**
 * Interface for short rate models, that is an SDE for the short rate
 * (or for latent factors whose sum is the short rate), discretized by an Euler-Maruyama scheme.
 *
 * A model is pure data together with a step function. It does not simulate itself, see
 * {@link net.shortrates.montecarlo.process.PathSimulator}.
 *
 * Implementations are immutable.
 */
public interface ShortRateModelInterface {

	ModelType getModelType();

	/**
	 * @return The number of state variables (and of random draws consumed per time step), 1 or 2.
	 */
	int getNumberOfFactors();

	/**
	 * @return The state at time t<sub>0</sub>.
	 */
	double[] getInitialState();

	/**
	 * Maps a state to the observable short rate.
	 *
	 * @param state The state.
	 * @return The short rate.
	 */
	double getShortRate(double[] state);

	/**
	 * @return The correlation of the Brownian drivers of a two factor model. One factor models return 0.
	 */
	default double getFactorCorrelation() {
		return 0.0;
	}

	/**
	 * Performs one Euler-Maruyama step. The method is pure.
	 *
	 * @param priorState The state at time index <code>timeIndex-1</code>.
	 * @param dt The time step, dt &gt; 0.
	 * @param randomDraws The (correlated) standard normal draws for this step, one per factor.
	 * @param timeIndex The time index of the state produced.
	 * @return The state at time index <code>timeIndex</code>.
	 */
	double[] getNextState(double[] priorState, double dt, double[] randomDraws, int timeIndex);

	/**
	 * Get the free parameters of this model, which may be used in calibration.
	 *
	 * @return Parameter vector.
	 */
	double[] getParameter();

	/**
	 * Return an instance of this model using a new set of parameters.
	 * Parameters outside the admissible domain are moved to its boundary.
	 *
	 * @param parameters The new set of parameters, same length as {@link #getParameter()}.
	 * @return A new model instance.
	 */
	ShortRateModelInterface getCloneWithModifiedParameters(double[] parameters);

	/**
	 * Return an instance of this model using a new initial state.
	 *
	 * @param initialState The new initial state.
	 * @return A new model instance.
	 */
	ShortRateModelInterface getCloneWithModifiedInitialState(double[] initialState);

	/**
	 * @return The names of the parameters in the order of {@link #getParameter()}.
	 */
	String[] getParameterNames();

	/**
	 * Checks that the model can be simulated on a grid with the given number of time steps.
	 * Models with time dependent parameters require one value per time step.
	 *
	 * @param numberOfTimeSteps The number of time steps of the simulation grid.
	 * @throws IllegalArgumentException If the model does not fit the grid.
	 */
	default void checkNumberOfTimeSteps(int numberOfTimeSteps) {
	}
}
