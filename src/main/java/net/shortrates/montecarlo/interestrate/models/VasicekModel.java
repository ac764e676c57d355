package net.shortrates.montecarlo.interestrate.models;

import net.shortrates.montecarlo.interestrate.ModelType;

/**
 * Vasicek model <i>dr = &beta; (&alpha; - r) dt + &sigma; dW</i>, mean reverting to the long run
 * level &alpha; with speed &beta;.
 */
public class VasicekModel extends AbstractOneFactorShortRateModel {

	private final double alpha;
	private final double beta;
	private final double sigma;

	/**
	 * @param initialRate The short rate at time 0.
	 * @param alpha The long run mean.
	 * @param beta The mean reversion speed, &beta; &ge; 0.
	 * @param sigma The volatility, &sigma; &ge; 0.
	 */
	public VasicekModel(double initialRate, double alpha, double beta, double sigma) {
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
		return sigma;
	}

	@Override
	public ModelType getModelType() {
		return ModelType.VASICEK;
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
	public VasicekModel getCloneWithModifiedParameters(double[] parameters) {
		checkNumberOfParameters(parameters);
		return new VasicekModel(getInitialRate(), parameters[0], Math.max(parameters[1], 0.0), Math.max(parameters[2], 0.0));
	}

	@Override
	public VasicekModel getCloneWithModifiedInitialRate(double initialRate) {
		return new VasicekModel(initialRate, alpha, beta, sigma);
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
