package net.shortrates.montecarlo.interestrate;

import net.finmath.time.TimeDiscretization;
import net.shortrates.marketdata.curves.SpotCurve;
import net.shortrates.montecarlo.MersenneTwisterRandomSource;
import net.shortrates.montecarlo.interestrate.models.CIRModel;
import net.shortrates.montecarlo.interestrate.models.DothanModel;
import net.shortrates.montecarlo.interestrate.models.MertonModel;
import net.shortrates.montecarlo.interestrate.products.DiscountFactor;
import net.shortrates.montecarlo.process.PathEnsemble;
import net.shortrates.montecarlo.process.PathSimulator;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class DiscountCurveEstimatorTest {

    private final DiscountCurveEstimator estimator = new DiscountCurveEstimator();

    @Test
    public void testSpotCurveOfHandComputedEnsemble() {
        double dt = 0.5;
        PathEnsemble ensemble = new PathEnsemble(new TimeDiscretization(0.0, 3, dt), new double[][] {
                { 0.02, 0.02 },
                { 0.04, 0.00 },
                { 0.06, 0.02 }
        });

        SpotCurve spotCurve = estimator.estimate(ensemble);

        double discountFactor2 = (Math.exp(-dt * (0.02 + 0.04)) + Math.exp(-dt * (0.02 + 0.00))) / 2.0;
        double discountFactor3 = (Math.exp(-dt * (0.02 + 0.04 + 0.06)) + Math.exp(-dt * (0.02 + 0.00 + 0.02))) / 2.0;
        assertEquals(3, spotCurve.getNumberOfMaturities());
        assertEquals(0.02, spotCurve.getSpotRate(1), 0.0);
        assertEquals(-Math.log(discountFactor2) / (2 * dt), spotCurve.getSpotRate(2), 1E-14);
        assertEquals(-Math.log(discountFactor3) / (3 * dt), spotCurve.getSpotRate(3), 1E-14);
        assertEquals(1.5, spotCurve.getMaturity(3), 1E-12);
    }

    @Test
    public void testThatConstantRateGivesFlatCurve() {
        PathEnsemble ensemble = new PathSimulator(new MersenneTwisterRandomSource(31415))
                .simulate(new MertonModel(0.03, 0.0, 0.0), new TimeDiscretization(0.0, 24, 0.25), 10);

        SpotCurve spotCurve = estimator.estimate(ensemble);

        for(double spotRate : spotCurve.getValues()) {
            assertEquals(0.03, spotRate, 1E-14);
        }
    }

    @Test
    public void testThatEstimateAgreesWithDiscountFactorProduct() {
        PathEnsemble ensemble = new PathSimulator(new MersenneTwisterRandomSource(31415))
                .simulate(new CIRModel(0.015, 0.03, 0.5, 0.05), new TimeDiscretization(0.0, 60, 1.0 / 12.0), 1000);

        SpotCurve spotCurve = estimator.estimate(ensemble);

        for(int maturity = 2; maturity <= 60; maturity++) {
            double price = new DiscountFactor(maturity).getPrice(ensemble);
            assertEquals(price, spotCurve.getDiscountFactor(maturity), 1E-13);
        }
        assertTrue(spotCurve.isFinite());
    }

    @Test
    public void testThatUnderflowIsReportedAsInfiniteSpotRate() {
        PathEnsemble ensemble = new PathEnsemble(new TimeDiscretization(0.0, 3, 1.0), new double[][] {
                { 0.01, 0.01 },
                { 1000.0, 2000.0 },
                { 1000.0, 2000.0 }
        });

        SpotCurve spotCurve = estimator.estimate(ensemble);

        assertEquals(0.01, spotCurve.getSpotRate(1), 0.0);
        assertEquals(Double.POSITIVE_INFINITY, spotCurve.getSpotRate(2), 0.0);
        assertEquals(Double.POSITIVE_INFINITY, spotCurve.getSpotRate(3), 0.0);
        assertFalse(spotCurve.isFinite());
    }

    @Test
    public void testThatDothanSpotRatesAreFiniteAndNonNegative() {
        PathEnsemble ensemble = new PathSimulator(new MersenneTwisterRandomSource(31415))
                .simulate(new DothanModel(0.015, 0.2), new TimeDiscretization(0.0, 60, 1.0 / 12.0), 2000);

        SpotCurve spotCurve = estimator.estimate(ensemble);

        assertTrue(spotCurve.isFinite());
        for(double spotRate : spotCurve.getValues()) {
            assertTrue(spotRate >= 0.0);
        }
    }
}
