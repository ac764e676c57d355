package net.shortrates.calibration;

import java.util.Arrays;

import net.finmath.time.TimeDiscretizationInterface;
import net.shortrates.marketdata.curves.ObservedCurve;
import net.shortrates.marketdata.curves.SpotCurve;
import net.shortrates.montecarlo.MersenneTwisterRandomSource;
import net.shortrates.montecarlo.interestrate.DiscountCurveEstimator;
import net.shortrates.montecarlo.interestrate.ShortRateModelInterface;
import net.shortrates.montecarlo.process.PathSimulator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The sum of squared errors between an observed curve and the spot curve implied by a Monte Carlo
 * simulation of a model with trial parameters.
 *
 * Every evaluation simulates with a random source reset to the same seed, hence the objective is a
 * deterministic function of the parameters. Trials with a non finite error are scored with a finite penalty.
 * The objective keeps track of the best parameters seen and of the number of evaluations.
 *
 * Instances are not thread safe.
 */
public class CalibrationObjective {

	private static final Logger logger = LogManager.getLogger(CalibrationObjective.class);

	private final ShortRateModelInterface		initialModel;
	private final TimeDiscretizationInterface	timeDiscretization;
	private final int							numberOfPaths;
	private final ObservedCurve					observedCurve;
	private final double						penalty;

	private final PathSimulator				simulator;
	private final DiscountCurveEstimator	estimator = new DiscountCurveEstimator();

	private int			numberOfEvaluations = 0;
	private int			numberOfPenalties = 0;
	private double[]	bestParameters;
	private double		bestValue = Double.POSITIVE_INFINITY;

	public CalibrationObjective(ShortRateModelInterface initialModel, TimeDiscretizationInterface timeDiscretization, int numberOfPaths, int seed, ObservedCurve observedCurve, double penalty) {
		if(!(penalty > 0) || Double.isInfinite(penalty)) {
			throw new IllegalArgumentException("Penalty must be positive and finite: " + penalty + ".");
		}
		this.initialModel = initialModel;
		this.timeDiscretization = timeDiscretization;
		this.numberOfPaths = numberOfPaths;
		this.observedCurve = observedCurve;
		this.penalty = penalty;
		this.simulator = new PathSimulator(new MersenneTwisterRandomSource(seed));
		this.bestParameters = initialModel.getParameter();
	}

	/**
	 * Returns the sum of squared errors for the given parameters, or the penalty if it is not finite.
	 *
	 * @param parameters The trial parameters.
	 * @return The objective value.
	 */
	public double getValue(double[] parameters) {
		double[] modelValues = getModelValues(parameters);
		return modelValues == null ? penalty : getSumOfSquaredErrors(modelValues);
	}

	/**
	 * Calculates the model yields at the observed maturities for the given parameters and stores them in
	 * <code>values</code>. If a yield is not finite, all values are set such that the sum of squared
	 * errors equals the penalty.
	 *
	 * @param parameters The trial parameters.
	 * @param values Array receiving the model yields, one per observed maturity.
	 */
	public void setValues(double[] parameters, double[] values) {
		double[] modelValues = getModelValues(parameters);
		double[] targetValues = getTargetValues();
		for(int i = 0; i < values.length; i++) {
			values[i] = modelValues != null ? modelValues[i] : targetValues[i] + Math.sqrt(penalty / values.length);
		}
	}

	/*
	 * Returns null if the trial is scored with the penalty.
	 */
	private double[] getModelValues(double[] parameters) {
		numberOfEvaluations++;

		for(double parameter : parameters) {
			if(Double.isNaN(parameter) || Double.isInfinite(parameter)) {
				registerPenalty(parameters, "parameters not finite");
				return null;
			}
		}

		ShortRateModelInterface model = getModel(parameters);
		SpotCurve spotCurve = estimator.estimate(simulator.simulate(model, timeDiscretization, numberOfPaths));

		int[] maturities = observedCurve.getMaturities();
		double[] modelValues = new double[maturities.length];
		for(int i = 0; i < maturities.length; i++) {
			modelValues[i] = spotCurve.getSpotRate(maturities[i]);
		}

		double sumOfSquaredErrors = getSumOfSquaredErrors(modelValues);
		if(Double.isNaN(sumOfSquaredErrors) || Double.isInfinite(sumOfSquaredErrors)) {
			registerPenalty(parameters, "spot curve not finite");
			return null;
		}

		if(sumOfSquaredErrors < bestValue) {
			bestValue = sumOfSquaredErrors;
			bestParameters = model.getParameter();
		}
		return modelValues;
	}

	/*
	 * A penalized trial never becomes the best point. If no trial had a finite error, the best point
	 * remains the initial guess, scored with the penalty.
	 */
	private void registerPenalty(double[] parameters, String reason) {
		numberOfPenalties++;
		if(numberOfPenalties == 1) {
			logger.warn("Trial parameters {} scored with penalty {} ({}).", shortDescription(parameters), penalty, reason);
		}
		bestValue = Math.min(bestValue, penalty);
	}

	private double getSumOfSquaredErrors(double[] modelValues) {
		int[] maturities = observedCurve.getMaturities();
		double sumOfSquaredErrors = 0.0;
		for(int i = 0; i < maturities.length; i++) {
			double error = observedCurve.getYield(maturities[i]) - modelValues[i];
			sumOfSquaredErrors += error * error;
		}
		return sumOfSquaredErrors;
	}

	private static String shortDescription(double[] parameters) {
		return parameters.length <= 10 ? Arrays.toString(parameters) : "(" + parameters.length + " parameters)";
	}

	public ShortRateModelInterface getModel(double[] parameters) {
		return initialModel.getCloneWithModifiedParameters(parameters);
	}

	/**
	 * Returns the spot curve implied by the model with the given parameters, simulated with the
	 * same paths as the evaluations. Does not count as an evaluation.
	 *
	 * @param parameters The parameters.
	 * @return The spot curve.
	 */
	public SpotCurve getSpotCurve(double[] parameters) {
		return estimator.estimate(simulator.simulate(getModel(parameters), timeDiscretization, numberOfPaths));
	}

	public double[] getTargetValues() {
		int[] maturities = observedCurve.getMaturities();
		double[] targetValues = new double[maturities.length];
		for(int i = 0; i < maturities.length; i++) {
			targetValues[i] = observedCurve.getYield(maturities[i]);
		}
		return targetValues;
	}

	public double[] getBestParameters() {
		return bestParameters.clone();
	}

	public double getBestValue() {
		return bestValue;
	}

	public int getNumberOfEvaluations() {
		return numberOfEvaluations;
	}

	public int getNumberOfPenalties() {
		return numberOfPenalties;
	}

	public double getPenalty() {
		return penalty;
	}
}
