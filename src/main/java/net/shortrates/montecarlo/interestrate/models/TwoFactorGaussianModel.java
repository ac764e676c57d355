package net.shortrates.montecarlo.interestrate.models;

import net.shortrates.montecarlo.interestrate.ModelType;

/**
 * Two factor Gaussian model. The short rate is <i>r = x + y</i>, where the latent factors follow
 * Vasicek dynamics
 * <ul>
 * 	<li><i>dx = &beta;<sub>x</sub> (&alpha;<sub>x</sub> - x) dt + &sigma;<sub>x</sub> dW<sub>1</sub></i></li>
 * 	<li><i>dy = &beta;<sub>y</sub> (&alpha;<sub>y</sub> - y) dt + &sigma;<sub>y</sub> dW<sub>2</sub></i></li>
 * </ul>
 * with <i>dW<sub>1</sub> dW<sub>2</sub> = &rho; dt</i>. The correlation is fixed and not part of the
 * calibration parameters.
 */
public class TwoFactorGaussianModel extends AbstractShortRateModel {

	public static final double DEFAULT_CORRELATION = -0.1;

	private final double alphaX;
	private final double betaX;
	private final double sigmaX;
	private final double alphaY;
	private final double betaY;
	private final double sigmaY;
	private final double correlation;

	public TwoFactorGaussianModel(double initialX, double initialY,
			double alphaX, double betaX, double sigmaX,
			double alphaY, double betaY, double sigmaY,
			double correlation) {
		super(new double[] { initialX, initialY });
		this.alphaX = requireFinite("alphaX", alphaX);
		this.betaX = requireNonNegative("betaX", betaX);
		this.sigmaX = requireNonNegative("sigmaX", sigmaX);
		this.alphaY = requireFinite("alphaY", alphaY);
		this.betaY = requireNonNegative("betaY", betaY);
		this.sigmaY = requireNonNegative("sigmaY", sigmaY);
		if(!(Math.abs(correlation) <= 1.0)) {
			throw new IllegalArgumentException("Correlation must be within [-1, 1]: " + correlation + ".");
		}
		this.correlation = correlation;
	}

	public TwoFactorGaussianModel(double initialX, double initialY,
			double alphaX, double betaX, double sigmaX,
			double alphaY, double betaY, double sigmaY) {
		this(initialX, initialY, alphaX, betaX, sigmaX, alphaY, betaY, sigmaY, DEFAULT_CORRELATION);
	}

	private TwoFactorGaussianModel(double[] initialState, double[] parameter, double correlation) {
		super(initialState);
		this.alphaX = requireFinite("alphaX", parameter[0]);
		this.betaX = requireNonNegative("betaX", parameter[1]);
		this.sigmaX = requireNonNegative("sigmaX", parameter[2]);
		this.alphaY = requireFinite("alphaY", parameter[3]);
		this.betaY = requireNonNegative("betaY", parameter[4]);
		this.sigmaY = requireNonNegative("sigmaY", parameter[5]);
		this.correlation = correlation;
	}

	@Override
	public ModelType getModelType() {
		return ModelType.TWO_FACTOR_GAUSSIAN;
	}

	@Override
	public int getNumberOfFactors() {
		return 2;
	}

	@Override
	public double getShortRate(double[] state) {
		return state[0] + state[1];
	}

	@Override
	public double getFactorCorrelation() {
		return correlation;
	}

	@Override
	public double[] getNextState(double[] priorState, double dt, double[] randomDraws, int timeIndex) {
		double sqrtDt = Math.sqrt(dt);
		double x = priorState[0] + betaX * (alphaX - priorState[0]) * dt + sigmaX * randomDraws[0] * sqrtDt;
		double y = priorState[1] + betaY * (alphaY - priorState[1]) * dt + sigmaY * randomDraws[1] * sqrtDt;
		return new double[] { x, y };
	}

	@Override
	public double[] getParameter() {
		return new double[] { alphaX, betaX, sigmaX, alphaY, betaY, sigmaY };
	}

	@Override
	public String[] getParameterNames() {
		return new String[] { "alphaX", "betaX", "sigmaX", "alphaY", "betaY", "sigmaY" };
	}

	@Override
	public TwoFactorGaussianModel getCloneWithModifiedParameters(double[] parameters) {
		checkNumberOfParameters(parameters);
		double[] adjustedParameters = parameters.clone();
		adjustedParameters[1] = Math.max(adjustedParameters[1], 0.0);
		adjustedParameters[2] = Math.max(adjustedParameters[2], 0.0);
		adjustedParameters[4] = Math.max(adjustedParameters[4], 0.0);
		adjustedParameters[5] = Math.max(adjustedParameters[5], 0.0);
		return new TwoFactorGaussianModel(getInitialState(), adjustedParameters, correlation);
	}

	@Override
	public TwoFactorGaussianModel getCloneWithModifiedInitialState(double[] initialState) {
		if(initialState == null || initialState.length != 2) {
			throw new IllegalArgumentException(getModelType() + " model requires an initial state of length 2.");
		}
		return new TwoFactorGaussianModel(initialState, getParameter(), correlation);
	}

	public double getCorrelation() {
		return correlation;
	}
}
