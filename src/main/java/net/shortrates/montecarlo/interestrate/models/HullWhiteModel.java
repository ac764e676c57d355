package net.shortrates.montecarlo.interestrate.models;

import java.util.Arrays;

import net.shortrates.montecarlo.interestrate.ModelType;

/**
 * Hull-White extension of the Vasicek model with a time dependent mean level,
 * <i>dr = &beta; (&alpha;(t) - r) dt + &sigma; dW</i>, where &alpha; is given per time step of the simulation grid.
 *
 * The step producing time index <i>i</i> uses &alpha;[i]. Hence &alpha;[0], the level at t<sub>0</sub>,
 * does not enter the simulated paths; it is kept such that the parameter vector has one mean level per time step.
 *
 * The parameter vector used for calibration is <code>{ &beta;, &sigma;, &alpha;[0], ..., &alpha;[N-1] }</code>.
 */
public class HullWhiteModel extends AbstractOneFactorShortRateModel {

	private final double[]	alpha;
	private final double	beta;
	private final double	sigma;

	/**
	 * @param initialRate The short rate at time 0.
	 * @param alpha The mean levels, one per time step of the simulation grid.
	 * @param beta The mean reversion speed, &beta; &ge; 0.
	 * @param sigma The volatility, &sigma; &ge; 0.
	 */
	public HullWhiteModel(double initialRate, double[] alpha, double beta, double sigma) {
		super(initialRate);
		if(alpha == null || alpha.length == 0) {
			throw new IllegalArgumentException("Hull-White mean level vector must not be empty.");
		}
		for(int i=0; i<alpha.length; i++) {
			requireFinite("alpha[" + i + "]", alpha[i]);
		}
		this.alpha = alpha.clone();
		this.beta = requireNonNegative("beta", beta);
		this.sigma = requireNonNegative("sigma", sigma);
	}

	/**
	 * Creates a model with a flat mean level.
	 *
	 * @param initialRate The short rate at time 0.
	 * @param alpha The mean level used for every time step.
	 * @param numberOfTimeSteps The number of time steps of the simulation grid.
	 * @param beta The mean reversion speed.
	 * @param sigma The volatility.
	 */
	public HullWhiteModel(double initialRate, double alpha, int numberOfTimeSteps, double beta, double sigma) {
		this(initialRate, flat(alpha, numberOfTimeSteps), beta, sigma);
	}

	private static double[] flat(double value, int length) {
		if(length <= 0) {
			throw new IllegalArgumentException("Number of time steps must be positive: " + length + ".");
		}
		double[] values = new double[length];
		Arrays.fill(values, value);
		return values;
	}

	@Override
	public void checkNumberOfTimeSteps(int numberOfTimeSteps) {
		if(alpha.length != numberOfTimeSteps) {
			throw new IllegalArgumentException("Hull-White mean level vector must have " + numberOfTimeSteps + " entries, got " + alpha.length + ".");
		}
	}

	@Override
	public double getDrift(double shortRate, int timeIndex) {
		return beta * (alpha[timeIndex] - shortRate);
	}

	@Override
	public double getDiffusion(double shortRate, int timeIndex) {
		return sigma;
	}

	@Override
	public ModelType getModelType() {
		return ModelType.HULL_WHITE;
	}

	@Override
	public double[] getParameter() {
		double[] parameter = new double[2 + alpha.length];
		parameter[0] = beta;
		parameter[1] = sigma;
		System.arraycopy(alpha, 0, parameter, 2, alpha.length);
		return parameter;
	}

	@Override
	public String[] getParameterNames() {
		String[] names = new String[2 + alpha.length];
		names[0] = "beta";
		names[1] = "sigma";
		for(int i=0; i<alpha.length; i++) names[2+i] = "alpha[" + i + "]";
		return names;
	}

	@Override
	public HullWhiteModel getCloneWithModifiedParameters(double[] parameters) {
		checkNumberOfParameters(parameters);
		return new HullWhiteModel(getInitialRate(), Arrays.copyOfRange(parameters, 2, parameters.length), Math.max(parameters[0], 0.0), Math.max(parameters[1], 0.0));
	}

	@Override
	public HullWhiteModel getCloneWithModifiedInitialRate(double initialRate) {
		return new HullWhiteModel(initialRate, alpha, beta, sigma);
	}

	public double[] getAlpha() {
		return alpha.clone();
	}

	public double getBeta() {
		return beta;
	}

	public double getSigma() {
		return sigma;
	}

	public int getNumberOfTimeSteps() {
		return alpha.length;
	}
}
