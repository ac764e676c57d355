package net.shortrates.marketdata.curves;

import java.util.Arrays;

/**
 * A continuously compounded zero coupon spot curve on an equidistant grid of maturities.
 *
 * Maturities are given in time steps: maturity <i>m</i> (1 &le; m &le; N) corresponds to the time
 * <i>m &Delta;t</i>. The spot rate of maturity 1 is the initial short rate by convention.
 *
 * A spot rate may be {@link Double#POSITIVE_INFINITY} if the discount factor of its maturity could not be
 * estimated (underflow), see {@link #isFinite()}.
 */
public class SpotCurve {

	private final double	timeStep;
	private final double[]	spotRates;

	/**
	 * @param timeStep The time step &Delta;t, &gt; 0.
	 * @param spotRates The spot rates for the maturities 1, ..., N.
	 */
	public SpotCurve(double timeStep, double[] spotRates) {
		if(!(timeStep > 0)) {
			throw new IllegalArgumentException("Time step must be positive: " + timeStep + ".");
		}
		if(spotRates == null || spotRates.length == 0) {
			throw new IllegalArgumentException("Spot curve must have at least one maturity.");
		}
		this.timeStep = timeStep;
		this.spotRates = spotRates.clone();
	}

	public int getNumberOfMaturities() {
		return spotRates.length;
	}

	public double getTimeStep() {
		return timeStep;
	}

	/**
	 * @param maturityInSteps The maturity in time steps, 1 &le; maturityInSteps &le; N.
	 * @return The spot rate.
	 */
	public double getSpotRate(int maturityInSteps) {
		checkMaturity(maturityInSteps);
		return spotRates[maturityInSteps-1];
	}

	/**
	 * @param maturityInSteps The maturity in time steps, 1 &le; maturityInSteps &le; N.
	 * @return The maturity as a year fraction.
	 */
	public double getMaturity(int maturityInSteps) {
		checkMaturity(maturityInSteps);
		return maturityInSteps * timeStep;
	}

	/**
	 * @param maturityInSteps The maturity in time steps, 1 &le; maturityInSteps &le; N.
	 * @return The discount factor exp(-spot &middot; maturity).
	 */
	public double getDiscountFactor(int maturityInSteps) {
		return Math.exp(-getSpotRate(maturityInSteps) * getMaturity(maturityInSteps));
	}

	/**
	 * @return True if all spot rates are finite.
	 */
	public boolean isFinite() {
		for(double spotRate : spotRates) {
			if(Double.isNaN(spotRate) || Double.isInfinite(spotRate)) return false;
		}
		return true;
	}

	/**
	 * @return The spot rates for the maturities 1, ..., N.
	 */
	public double[] getValues() {
		return spotRates.clone();
	}

	private void checkMaturity(int maturityInSteps) {
		if(maturityInSteps < 1 || maturityInSteps > spotRates.length) {
			throw new IllegalArgumentException("Maturity must be within 1 and " + spotRates.length + ": " + maturityInSteps + ".");
		}
	}

	@Override
	public String toString() {
		return "SpotCurve [timeStep=" + timeStep + ", spotRates=" + Arrays.toString(spotRates) + "]";
	}
}
