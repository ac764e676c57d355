package net.shortrates.montecarlo.interestrate.models;

import net.shortrates.montecarlo.interestrate.ModelType;

/**
 * Dothan model <i>dr = &sigma; r dW</i>, a driftless geometric diffusion.
 *
 * The multiplicative diffusion keeps the sign of the rate as long as
 * <i>1 + &sigma; z &radic;dt</i> stays positive. No floor is applied.
 */
public class DothanModel extends AbstractOneFactorShortRateModel {

	private final double sigma;

	public DothanModel(double initialRate, double sigma) {
		super(initialRate);
		this.sigma = requireNonNegative("sigma", sigma);
	}

	@Override
	public double getDrift(double shortRate, int timeIndex) {
		return 0.0;
	}

	@Override
	public double getDiffusion(double shortRate, int timeIndex) {
		return sigma * shortRate;
	}

	@Override
	public ModelType getModelType() {
		return ModelType.DOTHAN;
	}

	@Override
	public double[] getParameter() {
		return new double[] { sigma };
	}

	@Override
	public String[] getParameterNames() {
		return new String[] { "sigma" };
	}

	@Override
	public DothanModel getCloneWithModifiedParameters(double[] parameters) {
		checkNumberOfParameters(parameters);
		return new DothanModel(getInitialRate(), Math.max(parameters[0], 0.0));
	}

	@Override
	public DothanModel getCloneWithModifiedInitialRate(double initialRate) {
		return new DothanModel(initialRate, sigma);
	}

	public double getSigma() {
		return sigma;
	}
}
