package net.shortrates.tests.montecarlo.interestrate;

import net.finmath.exception.CalculationException;
import net.finmath.time.TimeDiscretization;
import net.finmath.time.TimeDiscretizationInterface;
import net.shortrates.calibration.CalibrationResult;
import net.shortrates.calibration.ShortRateModelCalibrator;
import net.shortrates.marketdata.curves.ObservedCurve;
import net.shortrates.marketdata.curves.SpotCurve;
import net.shortrates.montecarlo.MersenneTwisterRandomSource;
import net.shortrates.montecarlo.interestrate.DiscountCurveEstimator;
import net.shortrates.montecarlo.interestrate.models.HullWhiteModel;
import net.shortrates.montecarlo.process.PathSimulator;
import net.shortrates.tests.montecarlo.interestrate.tools.AnalyticShortRateFormulas;
import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/*
 * Calibration of the 360 monthly mean levels of a Hull-White model to a 12 point rising yield curve.
 */
public class HullWhiteCalibrationTest {

    private static final double initialRate = 0.015;
    private static final int numberOfTimeSteps = 360;
    private static final double dt = 1.0 / 12.0;
    private static final int numberOfPaths = 500;
    private static final int seed = 31415;

    @Test
    public void testThatVectorCalibrationImprovesFitMonotonically() throws CalculationException {
        TimeDiscretizationInterface timeDiscretization = new TimeDiscretization(0.0, numberOfTimeSteps, dt);

        // Observed yields from a Vasicek curve rising from 1.5% towards 5%, every 2.5 years
        int[] maturities = new int[12];
        double[] yields = new double[12];
        for(int i = 0; i < 12; i++) {
            maturities[i] = 30 * (i + 1);
            yields[i] = AnalyticShortRateFormulas.getVasicekSpotRate(initialRate, 0.05, 0.2, 0.005, maturities[i] * dt);
        }
        ObservedCurve observedCurve = new ObservedCurve(maturities, yields);

        HullWhiteModel initialModel = new HullWhiteModel(initialRate, 0.01, numberOfTimeSteps, 0.2, 0.005);

        Map<String, Object> calibrationParameters = new HashMap<String, Object>();
        calibrationParameters.put("maxEvaluations", 600);
        calibrationParameters.put("numberOfRestarts", 1);
        ShortRateModelCalibrator calibrator = new ShortRateModelCalibrator(timeDiscretization, numberOfPaths, seed, calibrationParameters);

        CalibrationResult result = calibrator.calibrate(initialModel, observedCurve);

        assertEquals(2 + numberOfTimeSteps, result.getParameters().length);

        List<Double> history = result.getObjectiveHistory();
        assertTrue(history.size() >= 2);
        for(int i = 1; i < history.size(); i++) {
            assertTrue("objective increased in run " + i, history.get(i) <= history.get(i - 1));
        }
        assertTrue(result.getObjectiveValue() < result.getInitialObjectiveValue());

        SpotCurve initialCurve = new DiscountCurveEstimator().estimate(
                new PathSimulator(new MersenneTwisterRandomSource(seed)).simulate(initialModel, timeDiscretization, numberOfPaths));
        assertTrue(getSumOfSquaredErrors(observedCurve, result.getFittedCurve()) < getSumOfSquaredErrors(observedCurve, initialCurve));
    }

    private static double getSumOfSquaredErrors(ObservedCurve observedCurve, SpotCurve spotCurve) {
        double sumOfSquaredErrors = 0.0;
        for(int maturity : observedCurve.getMaturities()) {
            double error = observedCurve.getYield(maturity) - spotCurve.getSpotRate(maturity);
            sumOfSquaredErrors += error * error;
        }
        return sumOfSquaredErrors;
    }
}
