package net.shortrates.montecarlo.process;

import net.shortrates.montecarlo.RandomSourceInterface;
import net.shortrates.montecarlo.interestrate.ShortRateModelInterface;
import net.finmath.time.TimeDiscretizationInterface;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Simulates short rate trajectories of a {@link ShortRateModelInterface} using the Euler-Maruyama scheme.
 *
 * The random source is reset to its seed at the start of every simulation. Paths are simulated one after
 * another, each consuming its draws in time order, exactly one draw (or one correlated pair of draws) per time step. Re-running a
 * simulation with the same seed, model and time discretization hence reproduces the ensemble bit by bit.
 */
public class PathSimulator {

	private static final Logger logger = LogManager.getLogger(PathSimulator.class);

	// TimeDiscretization rounds times to a tick of one hour.
	private static final double TIME_TICK_TOLERANCE = 1.0 / (365.0 * 24.0) + 1E-12;

	private final RandomSourceInterface randomSource;

	public PathSimulator(RandomSourceInterface randomSource) {
		if(randomSource == null) {
			throw new IllegalArgumentException("Random source must not be null.");
		}
		this.randomSource = randomSource;
	}

	/**
	 * Simulates an ensemble of paths.
	 *
	 * @param model The short rate model.
	 * @param timeDiscretization The equidistant time discretization. The ensemble has one row per time step.
	 * @param numberOfPaths The number of paths, &gt; 0.
	 * @return The path ensemble.
	 * @throws IllegalArgumentException If the configuration is invalid. Checked before any simulation.
	 */
	public PathEnsemble simulate(ShortRateModelInterface model, TimeDiscretizationInterface timeDiscretization, int numberOfPaths) {
		if(model == null) {
			throw new IllegalArgumentException("Model must not be null.");
		}
		if(numberOfPaths <= 0) {
			throw new IllegalArgumentException("Number of paths must be positive: " + numberOfPaths + ".");
		}
		double dt = checkTimeDiscretization(timeDiscretization);
		int numberOfTimes = timeDiscretization.getNumberOfTimeSteps();
		model.checkNumberOfTimeSteps(numberOfTimes);

		int numberOfFactors = model.getNumberOfFactors();
		if(numberOfFactors != 1 && numberOfFactors != 2) {
			throw new IllegalArgumentException("Number of factors must be 1 or 2: " + numberOfFactors + ".");
		}
		double factorCorrelation = model.getFactorCorrelation();

		double[][] values = new double[numberOfTimes][numberOfPaths];
		double[][][] factorValues = numberOfFactors > 1 ? new double[numberOfFactors][numberOfTimes][numberOfPaths] : null;

		logger.debug("Simulating {} paths of {} on {} time steps with dt={} using {}.", numberOfPaths, model.getModelType(), numberOfTimes, dt, randomSource);

		randomSource.reset();
		double[] oneFactorDraw = new double[1];
		for(int pathIndex = 0; pathIndex < numberOfPaths; pathIndex++) {
			double[] state = model.getInitialState();
			store(model, state, 0, pathIndex, values, factorValues);
			for(int timeIndex = 1; timeIndex < numberOfTimes; timeIndex++) {
				double[] randomDraws;
				if(numberOfFactors == 1) {
					oneFactorDraw[0] = randomSource.nextNormal();
					randomDraws = oneFactorDraw;
				}
				else {
					randomDraws = randomSource.nextCorrelatedPair(factorCorrelation);
				}
				state = model.getNextState(state, dt, randomDraws, timeIndex);
				store(model, state, timeIndex, pathIndex, values, factorValues);
			}
		}

		return new PathEnsemble(timeDiscretization, values, factorValues);
	}

	private static void store(ShortRateModelInterface model, double[] state, int timeIndex, int pathIndex, double[][] values, double[][][] factorValues) {
		values[timeIndex][pathIndex] = model.getShortRate(state);
		if(factorValues != null) {
			for(int factor = 0; factor < factorValues.length; factor++) {
				factorValues[factor][timeIndex][pathIndex] = state[factor];
			}
		}
	}

	/**
	 * Checks that the time discretization starts at 0 and has a constant, positive time step.
	 *
	 * @param timeDiscretization The time discretization.
	 * @return The time step.
	 */
	static double checkTimeDiscretization(TimeDiscretizationInterface timeDiscretization) {
		if(timeDiscretization == null) {
			throw new IllegalArgumentException("Time discretization must not be null.");
		}
		if(timeDiscretization.getNumberOfTimeSteps() <= 0) {
			throw new IllegalArgumentException("Number of time steps must be positive: " + timeDiscretization.getNumberOfTimeSteps() + ".");
		}
		if(timeDiscretization.getTime(0) != 0.0) {
			throw new IllegalArgumentException("Time discretization must start at 0: " + timeDiscretization.getTime(0) + ".");
		}
		double dt = getTimeStep(timeDiscretization);
		if(!(dt > 0)) {
			throw new IllegalArgumentException("Time step must be positive: " + dt + ".");
		}
		for(int timeIndex = 0; timeIndex < timeDiscretization.getNumberOfTimeSteps(); timeIndex++) {
			if(Math.abs(timeDiscretization.getTimeStep(timeIndex) - dt) > TIME_TICK_TOLERANCE) {
				throw new IllegalArgumentException("Time discretization must have a constant time step " + dt + ", got " + timeDiscretization.getTimeStep(timeIndex) + " at index " + timeIndex + ".");
			}
		}
		return dt;
	}

	/**
	 * Returns the nominal time step of an equidistant time discretization, i.e. its length divided by
	 * its number of time steps.
	 *
	 * @param timeDiscretization The time discretization.
	 * @return The time step &Delta;t.
	 */
	public static double getTimeStep(TimeDiscretizationInterface timeDiscretization) {
		int numberOfTimeSteps = timeDiscretization.getNumberOfTimeSteps();
		return (timeDiscretization.getTime(numberOfTimeSteps) - timeDiscretization.getTime(0)) / numberOfTimeSteps;
	}

	public RandomSourceInterface getRandomSource() {
		return randomSource;
	}
}
