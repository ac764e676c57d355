package net.shortrates.montecarlo.process;

import net.finmath.montecarlo.RandomVariable;
import net.finmath.stochastic.RandomVariableInterface;
import net.finmath.time.TimeDiscretizationInterface;

/**
 * An ensemble of simulated short rate trajectories, given as a matrix with one row per time index
 * and one column per path.
 *
 * The ensemble has one row per time step of the time discretization, holding the states at
 * t<sub>0</sub>, ..., t<sub>N-1</sub>. Row 0 is the initial short rate.
 *
 * Instances are immutable.
 */
public class PathEnsemble {

	private final TimeDiscretizationInterface	timeDiscretization;
	private final double[][]					values;
	private final double[][][]					factorValues;

	/**
	 * Creates an ensemble from a matrix of short rates.
	 *
	 * @param timeDiscretization The time discretization, having as many time steps as the matrix has rows.
	 * @param values The short rates given as double[numberOfTimeSteps][numberOfPaths].
	 */
	public PathEnsemble(TimeDiscretizationInterface timeDiscretization, double[][] values) {
		this(timeDiscretization, copy(values), null);
	}

	PathEnsemble(TimeDiscretizationInterface timeDiscretization, double[][] values, double[][][] factorValues) {
		if(timeDiscretization == null) {
			throw new IllegalArgumentException("Time discretization must not be null.");
		}
		if(values.length == 0 || values.length != timeDiscretization.getNumberOfTimeSteps()) {
			throw new IllegalArgumentException("Ensemble must have one row per time step (" + timeDiscretization.getNumberOfTimeSteps() + "), got " + values.length + ".");
		}
		int numberOfPaths = values[0].length;
		if(numberOfPaths == 0) {
			throw new IllegalArgumentException("Ensemble must have at least one path.");
		}
		for(double[] row : values) {
			if(row.length != numberOfPaths) {
				throw new IllegalArgumentException("All rows of the ensemble must have " + numberOfPaths + " paths.");
			}
		}
		this.timeDiscretization = timeDiscretization;
		this.values = values;
		this.factorValues = factorValues;
	}

	private static double[][] copy(double[][] matrix) {
		double[][] copy = new double[matrix.length][];
		for(int row = 0; row < matrix.length; row++) {
			copy[row] = matrix[row].clone();
		}
		return copy;
	}

	public TimeDiscretizationInterface getTimeDiscretization() {
		return timeDiscretization;
	}

	public int getNumberOfTimes() {
		return values.length;
	}

	public int getNumberOfPaths() {
		return values[0].length;
	}

	/**
	 * @return The time step &Delta;t of the (equidistant) time discretization.
	 */
	public double getTimeStep() {
		return PathSimulator.getTimeStep(timeDiscretization);
	}

	public double getValue(int timeIndex, int pathIndex) {
		return values[timeIndex][pathIndex];
	}

	/**
	 * Returns the short rate at a given time index as a random variable over all paths.
	 *
	 * @param timeIndex The time index.
	 * @return The short rate realizations at time t<sub>timeIndex</sub>.
	 */
	public RandomVariableInterface getProcessValue(int timeIndex) {
		return new RandomVariable(timeDiscretization.getTime(timeIndex), values[timeIndex].clone());
	}

	/**
	 * @return The number of latent factors stored with this ensemble, 0 if the short rate is the only state.
	 */
	public int getNumberOfFactorPaths() {
		return factorValues == null ? 0 : factorValues.length;
	}

	/**
	 * @param factor The index of the latent factor.
	 * @return The paths of a latent factor given as double[numberOfTimeSteps][numberOfPaths].
	 */
	public double[][] getFactorPaths(int factor) {
		if(factorValues == null || factor < 0 || factor >= factorValues.length) {
			throw new IllegalArgumentException("Ensemble has no factor paths with index " + factor + ".");
		}
		return copy(factorValues[factor]);
	}

	public double getAverage(int timeIndex) {
		return getProcessValue(timeIndex).getAverage();
	}

	public double getStandardDeviation(int timeIndex) {
		return getProcessValue(timeIndex).getStandardDeviation();
	}

	/**
	 * @return The smallest value of the ensemble.
	 */
	public double getMinimum() {
		double minimum = Double.POSITIVE_INFINITY;
		for(double[] row : values) {
			for(double value : row) {
				minimum = Math.min(minimum, value);
			}
		}
		return minimum;
	}

	/**
	 * @return A copy of the ensemble matrix, given as double[numberOfTimeSteps][numberOfPaths].
	 */
	public double[][] getValues() {
		return copy(values);
	}
}
