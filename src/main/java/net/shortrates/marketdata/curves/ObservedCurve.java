package net.shortrates.marketdata.curves;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * An observed yield curve, given as a sparse map from maturity (in time steps of the simulation grid)
 * to the continuously compounded yield, expressed as a decimal rate.
 *
 * Instances are immutable.
 */
public class ObservedCurve {

	private final SortedMap<Integer, Double> yields;

	public ObservedCurve(Map<Integer, Double> yields) {
		if(yields == null || yields.isEmpty()) {
			throw new IllegalArgumentException("Observed curve must have at least one maturity.");
		}
		TreeMap<Integer, Double> sortedYields = new TreeMap<>();
		for(Map.Entry<Integer, Double> entry : yields.entrySet()) {
			Integer maturity = entry.getKey();
			Double yield = entry.getValue();
			if(maturity == null || maturity < 1) {
				throw new IllegalArgumentException("Observed maturity must be a positive number of time steps: " + maturity + ".");
			}
			if(yield == null || yield.isNaN() || yield.isInfinite()) {
				throw new IllegalArgumentException("Observed yield for maturity " + maturity + " must be finite: " + yield + ".");
			}
			sortedYields.put(maturity, yield);
		}
		this.yields = Collections.unmodifiableSortedMap(sortedYields);
	}

	public ObservedCurve(int[] maturities, double[] yields) {
		this(toMap(maturities, yields));
	}

	private static Map<Integer, Double> toMap(int[] maturities, double[] yields) {
		if(maturities.length != yields.length) {
			throw new IllegalArgumentException("Number of maturities (" + maturities.length + ") and yields (" + yields.length + ") differ.");
		}
		Map<Integer, Double> map = new TreeMap<>();
		for(int i = 0; i < maturities.length; i++) {
			if(map.put(maturities[i], yields[i]) != null) {
				throw new IllegalArgumentException("Duplicate observed maturity: " + maturities[i] + ".");
			}
		}
		return map;
	}

	/**
	 * Samples a spot curve at given maturities.
	 *
	 * @param spotCurve The spot curve.
	 * @param maturities The maturities in time steps.
	 * @return The observed curve.
	 */
	public static ObservedCurve fromSpotCurve(SpotCurve spotCurve, int... maturities) {
		double[] yields = new double[maturities.length];
		for(int i = 0; i < maturities.length; i++) {
			yields[i] = spotCurve.getSpotRate(maturities[i]);
		}
		return new ObservedCurve(maturities, yields);
	}

	public int size() {
		return yields.size();
	}

	public int[] getMaturities() {
		return yields.keySet().stream().mapToInt(Integer::intValue).toArray();
	}

	public double getYield(int maturityInSteps) {
		Double yield = yields.get(maturityInSteps);
		if(yield == null) {
			throw new IllegalArgumentException("No observed yield for maturity " + maturityInSteps + ".");
		}
		return yield;
	}

	public int getLastMaturity() {
		return yields.lastKey();
	}

	/**
	 * Checks that all observed maturities lie on a grid with the given number of time steps.
	 *
	 * @param numberOfTimeSteps The number of time steps of the simulation grid.
	 */
	public void validateAgainst(int numberOfTimeSteps) {
		if(getLastMaturity() > numberOfTimeSteps) {
			throw new IllegalArgumentException("Observed maturity " + getLastMaturity() + " exceeds the number of time steps " + numberOfTimeSteps + ".");
		}
	}

	public SortedMap<Integer, Double> asMap() {
		return yields;
	}

	@Override
	public String toString() {
		return "ObservedCurve " + yields;
	}
}
