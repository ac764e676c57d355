package net.shortrates.tests.montecarlo.interestrate;

import net.finmath.time.TimeDiscretization;
import net.finmath.time.TimeDiscretizationInterface;
import net.shortrates.marketdata.curves.SpotCurve;
import net.shortrates.montecarlo.MersenneTwisterRandomSource;
import net.shortrates.montecarlo.interestrate.DiscountCurveEstimator;
import net.shortrates.montecarlo.interestrate.models.VasicekModel;
import net.shortrates.montecarlo.process.PathEnsemble;
import net.shortrates.montecarlo.process.PathSimulator;
import net.shortrates.tests.montecarlo.interestrate.tools.AnalyticShortRateFormulas;
import org.junit.BeforeClass;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

/*
 * Compares the Monte Carlo spot curve of the Vasicek model with the closed form.
 */
public class VasicekSpotCurveConvergenceTest {

    private static final double initialRate = 0.015;
    private static final double alpha = 0.03;
    private static final double beta = 0.01;
    private static final double sigma = 0.002;

    private static final double horizon = 5.0;
    private static final int numberOfTimeSteps = 60;
    private static final int numberOfPaths = 100000;
    private static final int seed = 31415;

    private static SpotCurve spotCurve;

    @BeforeClass
    public static void simulate() {
        TimeDiscretizationInterface timeDiscretization = new TimeDiscretization(0.0, numberOfTimeSteps, horizon / numberOfTimeSteps);
        PathEnsemble ensemble = new PathSimulator(new MersenneTwisterRandomSource(seed)).simulate(new VasicekModel(initialRate, alpha, beta, sigma), timeDiscretization, numberOfPaths);
        spotCurve = new DiscountCurveEstimator().estimate(ensemble);
    }

    @Test
    public void testThatSpotRateAtHorizonMatchesClosedForm() {
        double analyticSpotRate = AnalyticShortRateFormulas.getVasicekSpotRate(initialRate, alpha, beta, sigma, horizon);

        assertEquals(analyticSpotRate, spotCurve.getSpotRate(numberOfTimeSteps), 5E-4);
    }

    @Test
    public void testThatWholeSpotCurveMatchesClosedForm() {
        double[] analyticSpotCurve = AnalyticShortRateFormulas.getVasicekSpotCurve(initialRate, alpha, beta, sigma, horizon / numberOfTimeSteps, numberOfTimeSteps);

        for(int maturity = 1; maturity <= numberOfTimeSteps; maturity++) {
            assertEquals("maturity " + maturity, analyticSpotCurve[maturity - 1], spotCurve.getSpotRate(maturity), 1E-3);
        }
    }

    @Test
    public void testThatFirstSpotRateIsInitialRate() {
        assertEquals(initialRate, spotCurve.getSpotRate(1), 0.0);
    }
}
