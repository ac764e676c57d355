package net.shortrates.montecarlo.interestrate.models;

import net.shortrates.montecarlo.interestrate.ModelType;

/**
 * Cox-Ingersoll-Ross model <i>dr = &beta; (&alpha; - r) dt + &sigma; &radic;r dW</i>.
 *
 * The Euler step may produce a negative rate. Such a state is absorbed at the next step:
 * if the prior rate is negative, the next rate is exactly 0 and no stochastic update is applied
 * in that step (the random draw is still consumed by the simulator). From 0 the normal update resumes.
 */
public class CIRModel extends AbstractOneFactorShortRateModel {

	private final double alpha;
	private final double beta;
	private final double sigma;

	public CIRModel(double initialRate, double alpha, double beta, double sigma) {
		super(initialRate);
		this.alpha = requireFinite("alpha", alpha);
		this.beta = requireNonNegative("beta", beta);
		this.sigma = requireNonNegative("sigma", sigma);
	}

	@Override
	public double getNextRate(double priorRate, double dt, double randomDraw, int timeIndex) {
		if(priorRate < 0) {
			return 0.0;
		}
		return super.getNextRate(priorRate, dt, randomDraw, timeIndex);
	}

	@Override
	public double getDrift(double shortRate, int timeIndex) {
		return beta * (alpha - shortRate);
	}

	@Override
	public double getDiffusion(double shortRate, int timeIndex) {
		return sigma * Math.sqrt(Math.max(shortRate, 0.0));
	}

	@Override
	public ModelType getModelType() {
		return ModelType.CIR;
	}

	@Override
	public double[] getParameter() {
		return new double[] { alpha, beta, sigma };
	}

	@Override
	public String[] getParameterNames() {
		return new String[] { "alpha", "beta", "sigma" };
	}

	@Override
	public CIRModel getCloneWithModifiedParameters(double[] parameters) {
		checkNumberOfParameters(parameters);
		return new CIRModel(getInitialRate(), parameters[0], Math.max(parameters[1], 0.0), Math.max(parameters[2], 0.0));
	}

	@Override
	public CIRModel getCloneWithModifiedInitialRate(double initialRate) {
		return new CIRModel(initialRate, alpha, beta, sigma);
	}

	public double getAlpha() {
		return alpha;
	}

	public double getBeta() {
		return beta;
	}

	public double getSigma() {
		return sigma;
	}
}
