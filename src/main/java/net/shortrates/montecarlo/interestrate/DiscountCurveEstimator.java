package net.shortrates.montecarlo.interestrate;

import net.shortrates.marketdata.curves.SpotCurve;
import net.shortrates.montecarlo.interestrate.products.DiscountFactor;
import net.shortrates.montecarlo.process.PathEnsemble;
import net.finmath.stochastic.RandomVariableInterface;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Estimates the continuously compounded spot curve implied by an ensemble of short rate paths.
 *
 * For maturity <i>m</i> (in time steps) the zero coupon bond price is estimated as the path average of
 * the discount factor <i>exp(-&Delta;t (r<sub>0</sub> + ... + r<sub>m-1</sub>))</i>,
 * see {@link DiscountFactor}, and converted to the spot rate <i>-ln(P) / (m &Delta;t)</i>.
 * The spot rate of maturity 1 is set to the initial short rate.
 *
 * If a price estimate underflows to 0 (or is not finite) the spot rate is reported as
 * {@link Double#POSITIVE_INFINITY}.
 *
 * The estimator is stateless.
 */
public class DiscountCurveEstimator {

	private static final Logger logger = LogManager.getLogger(DiscountCurveEstimator.class);

	public SpotCurve estimate(PathEnsemble ensemble) {
		int numberOfMaturities = ensemble.getNumberOfTimes();
		double dt = ensemble.getTimeStep();

		double[] spotRates = new double[numberOfMaturities];
		spotRates[0] = ensemble.getValue(0, 0);

		int numberOfDegenerateMaturities = 0;
		RandomVariableInterface[] discountFactors = DiscountFactor.getValues(ensemble);
		for(int timeIndex = 1; timeIndex < numberOfMaturities; timeIndex++) {
			double discountFactor = discountFactors[timeIndex].getAverage();
			int maturityInSteps = timeIndex + 1;
			if(discountFactor > 0 && !Double.isInfinite(discountFactor)) {
				spotRates[timeIndex] = -Math.log(discountFactor) / (maturityInSteps * dt);
			}
			else {
				spotRates[timeIndex] = Double.POSITIVE_INFINITY;
				numberOfDegenerateMaturities++;
			}
		}

		if(numberOfDegenerateMaturities > 0) {
			logger.warn("Discount factor estimate degenerate (zero or not finite) for {} of {} maturities. Spot rates reported as infinite.", numberOfDegenerateMaturities, numberOfMaturities);
		}

		return new SpotCurve(dt, spotRates);
	}
}
