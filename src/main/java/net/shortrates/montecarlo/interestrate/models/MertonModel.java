package net.shortrates.montecarlo.interestrate.models;

import net.shortrates.montecarlo.interestrate.ModelType;

/**
 * Merton model <i>dr = &alpha; dt + &sigma; dW</i>, an arithmetic Brownian motion with drift.
 */
public class MertonModel extends AbstractOneFactorShortRateModel {

	private final double alpha;
	private final double sigma;

	public MertonModel(double initialRate, double alpha, double sigma) {
		super(initialRate);
		this.alpha = requireFinite("alpha", alpha);
		this.sigma = requireNonNegative("sigma", sigma);
	}

	@Override
	public double getDrift(double shortRate, int timeIndex) {
		return alpha;
	}

	@Override
	public double getDiffusion(double shortRate, int timeIndex) {
		return sigma;
	}

	@Override
	public ModelType getModelType() {
		return ModelType.MERTON;
	}

	@Override
	public double[] getParameter() {
		return new double[] { alpha, sigma };
	}

	@Override
	public String[] getParameterNames() {
		return new String[] { "alpha", "sigma" };
	}

	@Override
	public MertonModel getCloneWithModifiedParameters(double[] parameters) {
		checkNumberOfParameters(parameters);
		return new MertonModel(getInitialRate(), parameters[0], Math.max(parameters[1], 0.0));
	}

	@Override
	public MertonModel getCloneWithModifiedInitialRate(double initialRate) {
		return new MertonModel(initialRate, alpha, sigma);
	}

	public double getAlpha() {
		return alpha;
	}

	public double getSigma() {
		return sigma;
	}
}
