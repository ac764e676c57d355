package net.shortrates.montecarlo.interestrate.models;

import net.shortrates.montecarlo.interestrate.ModelType;

/**
 * Brennan-Schwartz model <i>dr = &beta; (&alpha; - r) dt + &sigma; r dW</i>,
 * mean reverting with proportional volatility.
 */
public class BrennanSchwartzModel extends AbstractOneFactorShortRateModel {

	private final double alpha;
	private final double beta;
	private final double sigma;

	public BrennanSchwartzModel(double initialRate, double alpha, double beta, double sigma) {
		super(initialRate);
		this.alpha = requireFinite("alpha", alpha);
		this.beta = requireNonNegative("beta", beta);
		this.sigma = requireNonNegative("sigma", sigma);
	}

	@Override
	public double getDrift(double shortRate, int timeIndex) {
		return beta * (alpha - shortRate);
	}

	@Override
	public double getDiffusion(double shortRate, int timeIndex) {
		return sigma * shortRate;
	}

	@Override
	public ModelType getModelType() {
		return ModelType.BRENNAN_SCHWARTZ;
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
	public BrennanSchwartzModel getCloneWithModifiedParameters(double[] parameters) {
		checkNumberOfParameters(parameters);
		return new BrennanSchwartzModel(getInitialRate(), parameters[0], Math.max(parameters[1], 0.0), Math.max(parameters[2], 0.0));
	}

	@Override
	public BrennanSchwartzModel getCloneWithModifiedInitialRate(double initialRate) {
		return new BrennanSchwartzModel(initialRate, alpha, beta, sigma);
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
