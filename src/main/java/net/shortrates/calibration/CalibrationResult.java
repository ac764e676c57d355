package net.shortrates.calibration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import net.shortrates.marketdata.curves.SpotCurve;
import net.shortrates.montecarlo.interestrate.ShortRateModelInterface;

/**
 * Result of a calibration: the best model found, its objective value and diagnostics of the search.
 */
public class CalibrationResult {

	private final ShortRateModelInterface	calibratedModel;
	private final double					objectiveValue;
	private final double					initialObjectiveValue;
	private final boolean					converged;
	private final int						numberOfEvaluations;
	private final List<Double>				objectiveHistory;
	private final SpotCurve					fittedCurve;

	public CalibrationResult(ShortRateModelInterface calibratedModel, double objectiveValue, double initialObjectiveValue, boolean converged, int numberOfEvaluations, List<Double> objectiveHistory, SpotCurve fittedCurve) {
		this.calibratedModel = calibratedModel;
		this.objectiveValue = objectiveValue;
		this.initialObjectiveValue = initialObjectiveValue;
		this.converged = converged;
		this.numberOfEvaluations = numberOfEvaluations;
		this.objectiveHistory = Collections.unmodifiableList(new ArrayList<Double>(objectiveHistory));
		this.fittedCurve = fittedCurve;
	}

	public ShortRateModelInterface getCalibratedModel() {
		return calibratedModel;
	}

	public double[] getParameters() {
		return calibratedModel.getParameter();
	}

	/**
	 * @return The sum of squared errors of the calibrated model (or the penalty, if no trial had a finite error).
	 */
	public double getObjectiveValue() {
		return objectiveValue;
	}

	public double getInitialObjectiveValue() {
		return initialObjectiveValue;
	}

	/**
	 * @return False if the optimizer exhausted its budget before satisfying its convergence criterion.
	 */
	public boolean isConverged() {
		return converged;
	}

	public int getNumberOfEvaluations() {
		return numberOfEvaluations;
	}

	/**
	 * Returns the objective of the initial guess followed by the best objective after each optimizer run.
	 * The history is non-increasing.
	 *
	 * @return The objective history.
	 */
	public List<Double> getObjectiveHistory() {
		return objectiveHistory;
	}

	/**
	 * @return The spot curve of the calibrated model, simulated on the calibration paths.
	 */
	public SpotCurve getFittedCurve() {
		return fittedCurve;
	}

	@Override
	public String toString() {
		return "CalibrationResult [model=" + calibratedModel.getModelType()
				+ ", parameters=" + (getParameters().length <= 10 ? Arrays.toString(getParameters()) : getParameters().length + " parameters")
				+ ", objectiveValue=" + objectiveValue
				+ ", initialObjectiveValue=" + initialObjectiveValue
				+ ", converged=" + converged
				+ ", numberOfEvaluations=" + numberOfEvaluations + "]";
	}
}
