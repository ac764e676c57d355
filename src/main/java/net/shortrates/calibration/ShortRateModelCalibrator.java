package net.shortrates.calibration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import net.finmath.exception.CalculationException;
import net.finmath.optimizer.OptimizerFactoryLevenbergMarquardt;
import net.finmath.optimizer.OptimizerInterface;
import net.finmath.optimizer.OptimizerInterface.ObjectiveFunction;
import net.finmath.optimizer.SolverException;
import net.finmath.time.TimeDiscretizationInterface;
import net.shortrates.configuration.PropertyValues;
import net.shortrates.marketdata.curves.ObservedCurve;
import net.shortrates.montecarlo.interestrate.ShortRateModelInterface;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.AbstractSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.MultiDirectionalSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Calibrates the parameters of a short rate model to an observed yield curve by minimizing the sum of
 * squared errors between the observed yields and the Monte Carlo spot curve of the model.
 *
 * Calibration parameters may be passed using the map <code>calibrationParameters</code>. The keys are (<code>String</code>s):
 * <ul>
 * 	<li><tt>optimizer</tt>: an {@link OptimizerType} or its name, default <code>NELDER_MEAD</code>.</li>
 * 	<li><tt>maxEvaluations</tt>: maximum number of objective evaluations per optimizer run (simplex optimizers), default 2000.</li>
 * 	<li><tt>maxIterations</tt>: maximum number of iterations per optimizer run, default 400.</li>
 * 	<li><tt>accuracy</tt>: the optimizer stops if the objective does not improve by more than this number, default 1E-10.</li>
 * 	<li><tt>parameterStep</tt>: the initial simplex size (simplex optimizers) or the finite difference step
 * 		(Levenberg-Marquardt). Defaults to 10% of the absolute parameter value (1E-3 for a parameter value of 0)
 * 		for the simplex optimizers and to 1E-4 for Levenberg-Marquardt.</li>
 * 	<li><tt>numberOfRestarts</tt>: number of additional optimizer runs, each started from the best point found so far, default 0.</li>
 * 	<li><tt>penalty</tt>: objective value assigned to trials with non finite yields, default 1E10.</li>
 * </ul>
 *
 * The search is local. If the budget is exhausted the best parameters found are returned and the result is
 * flagged as not converged.
 */
public class ShortRateModelCalibrator {

	private static final Logger logger = LogManager.getLogger(ShortRateModelCalibrator.class);

	private static final int VECTOR_PARAMETER_MODE_DIMENSION = 10;

	private final TimeDiscretizationInterface	timeDiscretization;
	private final int							numberOfPaths;
	private final int							seed;

	private final OptimizerType	optimizerType;
	private final int			maxEvaluations;
	private final int			maxIterations;
	private final double		accuracy;
	private final Double		parameterStep;
	private final int			numberOfRestarts;
	private final double		penalty;

	/**
	 * @param timeDiscretization The simulation grid shared by the simulation and the estimation of the spot curve.
	 * @param numberOfPaths The number of Monte Carlo paths per evaluation.
	 * @param seed The seed used for every evaluation.
	 * @param calibrationParameters Optional calibration parameters, may be null.
	 */
	public ShortRateModelCalibrator(TimeDiscretizationInterface timeDiscretization, int numberOfPaths, int seed, Map<String, ?> calibrationParameters) {
		if(timeDiscretization == null) {
			throw new IllegalArgumentException("Time discretization must not be null.");
		}
		if(numberOfPaths <= 0) {
			throw new IllegalArgumentException("Number of paths must be positive: " + numberOfPaths + ".");
		}
		this.timeDiscretization = timeDiscretization;
		this.numberOfPaths = numberOfPaths;
		this.seed = seed;

		optimizerType		= OptimizerType.of(PropertyValues.getString(calibrationParameters, "optimizer", OptimizerType.NELDER_MEAD.name()));
		maxEvaluations		= PropertyValues.getInteger(calibrationParameters, "maxEvaluations", 2000);
		maxIterations		= PropertyValues.getInteger(calibrationParameters, "maxIterations", 400);
		accuracy			= PropertyValues.getDouble(calibrationParameters, "accuracy", 1E-10);
		parameterStep		= PropertyValues.contains(calibrationParameters, "parameterStep") ? PropertyValues.getDouble(calibrationParameters, "parameterStep") : null;
		numberOfRestarts	= PropertyValues.getInteger(calibrationParameters, "numberOfRestarts", 0);
		penalty				= PropertyValues.getDouble(calibrationParameters, "penalty", 1E10);

		if(maxEvaluations <= 0) throw new IllegalArgumentException("Maximum number of evaluations must be positive: " + maxEvaluations + ".");
		if(maxIterations <= 0) throw new IllegalArgumentException("Maximum number of iterations must be positive: " + maxIterations + ".");
		if(!(accuracy > 0)) throw new IllegalArgumentException("Accuracy must be positive: " + accuracy + ".");
		if(parameterStep != null && !(parameterStep > 0)) throw new IllegalArgumentException("Parameter step must be positive: " + parameterStep + ".");
		if(numberOfRestarts < 0) throw new IllegalArgumentException("Number of restarts must not be negative: " + numberOfRestarts + ".");
		if(!(penalty > 0) || Double.isInfinite(penalty)) throw new IllegalArgumentException("Penalty must be positive and finite: " + penalty + ".");
	}

	/**
	 * Calibrates the model to the observed curve, starting from the parameters of the given model.
	 *
	 * @param initialModel The model providing the initial guess (and all values which are not calibrated).
	 * @param observedCurve The observed yields.
	 * @return The calibration result.
	 * @throws CalculationException Thrown if the optimizer failed.
	 * @throws IllegalArgumentException If the model or the observed curve does not fit the time discretization.
	 */
	public CalibrationResult calibrate(ShortRateModelInterface initialModel, ObservedCurve observedCurve) throws CalculationException {
		if(initialModel == null) {
			throw new IllegalArgumentException("Model must not be null.");
		}
		if(observedCurve == null) {
			throw new IllegalArgumentException("Observed curve must not be null.");
		}
		int numberOfTimeSteps = timeDiscretization.getNumberOfTimeSteps();
		observedCurve.validateAgainst(numberOfTimeSteps);
		initialModel.checkNumberOfTimeSteps(numberOfTimeSteps);

		double[] initialParameters = initialModel.getParameter();
		int dimension = initialParameters.length;
		logger.info("Calibrating {} model with {} parameters ({} mode) to {} observed yields using {}, at most {} evaluations per run and {} restarts.",
				initialModel.getModelType(), dimension, dimension > VECTOR_PARAMETER_MODE_DIMENSION ? "vector parameter" : "scalar",
						observedCurve.size(), optimizerType, maxEvaluations, numberOfRestarts);

		CalibrationObjective objective = new CalibrationObjective(initialModel, timeDiscretization, numberOfPaths, seed, observedCurve, penalty);

		double initialObjectiveValue = objective.getValue(initialParameters);
		List<Double> objectiveHistory = new ArrayList<Double>();
		objectiveHistory.add(initialObjectiveValue);

		boolean converged = false;
		for(int run = 0; run <= numberOfRestarts; run++) {
			double objectiveBeforeRun = objective.getBestValue();
			converged = runOptimizer(objective, objective.getBestParameters());
			objectiveHistory.add(objective.getBestValue());

			logger.debug("Optimizer run {} of {}: objective {} (before {}), converged={}, evaluations so far {}.",
					run + 1, numberOfRestarts + 1, objective.getBestValue(), objectiveBeforeRun, converged, objective.getNumberOfEvaluations());

			// A run from an unchanged starting point would repeat itself.
			if(!(objective.getBestValue() < objectiveBeforeRun)) break;
		}

		if(!converged) {
			logger.warn("Calibration of {} model did not converge within its budget. Returning the best parameters found (objective {}).", initialModel.getModelType(), objective.getBestValue());
		}

		double[] bestParameters = objective.getBestParameters();
		CalibrationResult result = new CalibrationResult(
				objective.getModel(bestParameters),
				objective.getBestValue(),
				initialObjectiveValue,
				converged,
				objective.getNumberOfEvaluations(),
				objectiveHistory,
				objective.getSpotCurve(bestParameters));

		logger.info("Calibration of {} model finished: objective {} (initial {}), converged={}, {} evaluations.",
				initialModel.getModelType(), result.getObjectiveValue(), initialObjectiveValue, converged, result.getNumberOfEvaluations());

		return result;
	}

	/*
	 * Runs the optimizer once. Returns true if it satisfied its convergence criterion.
	 */
	private boolean runOptimizer(final CalibrationObjective objective, double[] initialParameters) throws CalculationException {
		switch (optimizerType) {
		case NELDER_MEAD:
			return runSimplexOptimizer(objective, initialParameters, new NelderMeadSimplex(getSimplexSteps(initialParameters)));
		case MULTI_DIRECTIONAL:
			return runSimplexOptimizer(objective, initialParameters, new MultiDirectionalSimplex(getSimplexSteps(initialParameters)));
		case LEVENBERG_MARQUARDT:
			return runLevenbergMarquardt(objective, initialParameters);
		default:
			throw new IllegalArgumentException("Optimizer type " + optimizerType + " not supported.");
		}
	}

	private boolean runSimplexOptimizer(final CalibrationObjective objective, double[] initialParameters, AbstractSimplex simplex) {
		SimplexOptimizer optimizer = new SimplexOptimizer(accuracy, accuracy);
		try {
			optimizer.optimize(
					new MaxEval(maxEvaluations),
					new MaxIter(maxIterations),
					new org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction(objective::getValue),
					GoalType.MINIMIZE,
					new InitialGuess(initialParameters),
					simplex);
			return true;
		}
		catch(MaxCountExceededException e) {
			logger.debug("Simplex optimizer stopped: {}", e.getMessage());
			return false;
		}
	}

	private boolean runLevenbergMarquardt(final CalibrationObjective objective, double[] initialParameters) throws CalculationException {
		double[] lowerBound = new double[initialParameters.length];
		double[] upperBound = new double[initialParameters.length];
		double[] parameterSteps = new double[initialParameters.length];
		Arrays.fill(lowerBound, Double.NEGATIVE_INFINITY);
		Arrays.fill(upperBound, Double.POSITIVE_INFINITY);
		Arrays.fill(parameterSteps, parameterStep != null ? parameterStep.doubleValue() : 1E-4);

		ObjectiveFunction calibrationError = new ObjectiveFunction() {
			@Override
			public void setValues(double[] parameters, double[] values) throws SolverException {
				objective.setValues(parameters, values);
			}
		};

		// The objective is not thread safe, hence a single thread.
		OptimizerFactoryLevenbergMarquardt optimizerFactory = new OptimizerFactoryLevenbergMarquardt(maxIterations, accuracy, 1);
		OptimizerInterface optimizer = optimizerFactory.getOptimizer(calibrationError, initialParameters, lowerBound, upperBound, parameterSteps, objective.getTargetValues());
		try {
			optimizer.run();
		}
		catch(SolverException e) {
			throw new CalculationException(e);
		}

		return optimizer.getIterations() < maxIterations;
	}

	double[] getSimplexSteps(double[] initialParameters) {
		double[] steps = new double[initialParameters.length];
		for(int i = 0; i < steps.length; i++) {
			if(parameterStep != null) {
				steps[i] = parameterStep;
			}
			else {
				steps[i] = initialParameters[i] != 0.0 ? 0.1 * Math.abs(initialParameters[i]) : 1E-3;
			}
		}
		return steps;
	}

	public OptimizerType getOptimizerType() {
		return optimizerType;
	}

	public int getMaxEvaluations() {
		return maxEvaluations;
	}

	public int getNumberOfRestarts() {
		return numberOfRestarts;
	}

	public TimeDiscretizationInterface getTimeDiscretization() {
		return timeDiscretization;
	}
}
