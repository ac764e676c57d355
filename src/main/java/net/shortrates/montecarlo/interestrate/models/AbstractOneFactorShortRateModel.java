package net.shortrates.montecarlo.interestrate.models;

/**
 * Base class of one factor short rate models <i>dr = &mu;(r,t) dt + &sigma;(r,t) dW</i>.
 *
 * The default step is the Euler-Maruyama update
 * <i>r<sub>i</sub> = r<sub>i-1</sub> + &mu;(r<sub>i-1</sub>,i) dt + &sigma;(r<sub>i-1</sub>,i) z &radic;dt</i>.
 * Subclasses provide drift and diffusion and may override {@link #getNextRate(double, double, double, int)}
 * to impose a floor.
 */
public abstract class AbstractOneFactorShortRateModel extends AbstractShortRateModel {

	protected AbstractOneFactorShortRateModel(double initialRate) {
		super(new double[] { initialRate });
	}

	public double getInitialRate() {
		return getInitialState()[0];
	}

	/**
	 * @param shortRate The prior short rate.
	 * @param timeIndex The time index of the state produced.
	 * @return The drift &mu;(r,t).
	 */
	public abstract double getDrift(double shortRate, int timeIndex);

	/**
	 * @param shortRate The prior short rate.
	 * @param timeIndex The time index of the state produced.
	 * @return The diffusion &sigma;(r,t).
	 */
	public abstract double getDiffusion(double shortRate, int timeIndex);

	public double getNextRate(double priorRate, double dt, double randomDraw, int timeIndex) {
		return priorRate + getDrift(priorRate, timeIndex) * dt + getDiffusion(priorRate, timeIndex) * randomDraw * Math.sqrt(dt);
	}

	@Override
	public int getNumberOfFactors() {
		return 1;
	}

	@Override
	public double getShortRate(double[] state) {
		return state[0];
	}

	@Override
	public double[] getNextState(double[] priorState, double dt, double[] randomDraws, int timeIndex) {
		return new double[] { getNextRate(priorState[0], dt, randomDraws[0], timeIndex) };
	}

	@Override
	public AbstractOneFactorShortRateModel getCloneWithModifiedInitialState(double[] initialState) {
		if(initialState == null || initialState.length != 1) {
			throw new IllegalArgumentException(getModelType() + " model requires an initial state of length 1.");
		}
		return getCloneWithModifiedInitialRate(initialState[0]);
	}

	public abstract AbstractOneFactorShortRateModel getCloneWithModifiedInitialRate(double initialRate);
}
