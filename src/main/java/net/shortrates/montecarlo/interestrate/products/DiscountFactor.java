package net.shortrates.montecarlo.interestrate.products;

import net.shortrates.montecarlo.process.PathEnsemble;
import net.finmath.stochastic.RandomVariableInterface;

/**
 * The stochastic discount factor <i>exp(-&int;<sub>0</sub><sup>T</sup> r(s) ds)</i> of a maturity
 * <i>T = m &Delta;t</i>, where the integral is approximated by the left point rule
 * <i>&Delta;t (r<sub>0</sub> + ... + r<sub>m-1</sub>)</i> on the simulated grid.
 *
 * The Monte Carlo estimate of the zero coupon bond price is the average of the discount factor.
 */
public class DiscountFactor {

	private final int maturityInSteps;

	/**
	 * @param maturityInSteps The maturity in time steps, &gt; 0.
	 */
	public DiscountFactor(int maturityInSteps) {
		if(maturityInSteps < 1) {
			throw new IllegalArgumentException("Maturity must be a positive number of time steps: " + maturityInSteps + ".");
		}
		this.maturityInSteps = maturityInSteps;
	}

	/**
	 * @param ensemble The simulated short rates.
	 * @return The discount factor of each path.
	 */
	public RandomVariableInterface getValue(PathEnsemble ensemble) {
		if(maturityInSteps > ensemble.getNumberOfTimes()) {
			throw new IllegalArgumentException("Maturity " + maturityInSteps + " exceeds the number of simulated times " + ensemble.getNumberOfTimes() + ".");
		}
		RandomVariableInterface[] discountFactors = getValues(ensemble, maturityInSteps);
		return discountFactors[maturityInSteps-1];
	}

	/**
	 * @param ensemble The simulated short rates.
	 * @return The Monte Carlo estimate of the zero coupon bond price.
	 */
	public double getPrice(PathEnsemble ensemble) {
		return getValue(ensemble).getAverage();
	}

	public int getMaturityInSteps() {
		return maturityInSteps;
	}

	/**
	 * Returns the discount factors of all maturities <i>1, ..., N</i> of the ensemble in one pass.
	 *
	 * @param ensemble The simulated short rates.
	 * @return The discount factors, element <code>m-1</code> being the discount factor of maturity <code>m</code>.
	 */
	public static RandomVariableInterface[] getValues(PathEnsemble ensemble) {
		return getValues(ensemble, ensemble.getNumberOfTimes());
	}

	private static RandomVariableInterface[] getValues(PathEnsemble ensemble, int numberOfMaturities) {
		double dt = ensemble.getTimeStep();

		RandomVariableInterface[] discountFactors = new RandomVariableInterface[numberOfMaturities];
		RandomVariableInterface integratedRate = null;
		for(int timeIndex = 0; timeIndex < numberOfMaturities; timeIndex++) {
			RandomVariableInterface shortRate = ensemble.getProcessValue(timeIndex);
			integratedRate = integratedRate == null ? shortRate : integratedRate.add(shortRate);
			discountFactors[timeIndex] = integratedRate.mult(-dt).exp();
		}
		return discountFactors;
	}
}
