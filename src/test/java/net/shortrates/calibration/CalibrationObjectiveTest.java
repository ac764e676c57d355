package net.shortrates.calibration;

import net.finmath.time.TimeDiscretization;
import net.finmath.time.TimeDiscretizationInterface;
import net.shortrates.marketdata.curves.ObservedCurve;
import net.shortrates.montecarlo.interestrate.models.MertonModel;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CalibrationObjectiveTest {

    private final TimeDiscretizationInterface timeDiscretization = new TimeDiscretization(0.0, 60, 1.0 / 12.0);
    private final ObservedCurve observedCurve = new ObservedCurve(new int[] { 12, 36, 60 }, new double[] { 0.015, 0.016, 0.017 });
    private final MertonModel model = new MertonModel(0.015, 0.001, 0.001);

    @Test
    public void testThatObjectiveIsDeterministicSumOfSquaredErrors() {
        CalibrationObjective objective = new CalibrationObjective(model, timeDiscretization, 500, 31415, observedCurve, 1E10);

        double value = objective.getValue(model.getParameter());
        double[] modelValues = new double[3];
        objective.setValues(model.getParameter(), modelValues);

        double sumOfSquaredErrors = 0.0;
        for(int i = 0; i < 3; i++) {
            double error = observedCurve.getYield(observedCurve.getMaturities()[i]) - modelValues[i];
            sumOfSquaredErrors += error * error;
        }
        assertEquals(sumOfSquaredErrors, value, 1E-18);
        assertEquals(value, objective.getValue(model.getParameter()), 0.0);
        assertEquals(3, objective.getNumberOfEvaluations());
    }

    @Test
    public void testThatDegenerateTrialIsScoredWithPenalty() {
        CalibrationObjective objective = new CalibrationObjective(model, timeDiscretization, 500, 31415, observedCurve, 1E10);

        // a drift of 1000 underflows the discount factors of the longer maturities
        assertEquals(1E10, objective.getValue(new double[] { 1000.0, 0.001 }), 0.0);
        assertEquals(1E10, objective.getValue(new double[] { -1000.0, 0.001 }), 0.0);
        assertEquals(1E10, objective.getValue(new double[] { Double.NaN, 0.001 }), 0.0);
        assertEquals(3, objective.getNumberOfPenalties());

        double[] values = new double[3];
        objective.setValues(new double[] { 1000.0, 0.001 }, values);
        double sumOfSquaredErrors = 0.0;
        double[] targetValues = objective.getTargetValues();
        for(int i = 0; i < 3; i++) {
            sumOfSquaredErrors += (values[i] - targetValues[i]) * (values[i] - targetValues[i]);
        }
        assertEquals(1E10, sumOfSquaredErrors, 1E-3);
    }

    @Test
    public void testThatBestPointIsTracked() {
        CalibrationObjective objective = new CalibrationObjective(model, timeDiscretization, 500, 31415, observedCurve, 1E10);

        objective.getValue(new double[] { 1000.0, 0.001 });
        assertArrayEquals(model.getParameter(), objective.getBestParameters(), 0.0);

        double good = objective.getValue(new double[] { 0.001, 0.001 });
        double bad = objective.getValue(new double[] { 0.05, 0.001 });

        assertTrue(good < bad);
        assertEquals(good, objective.getBestValue(), 0.0);
        assertArrayEquals(new double[] { 0.001, 0.001 }, objective.getBestParameters(), 0.0);
    }

    @Test
    public void testThatBestParametersAreClamped() {
        CalibrationObjective objective = new CalibrationObjective(model, timeDiscretization, 500, 31415, observedCurve, 1E10);

        objective.getValue(new double[] { 0.001, -0.001 });

        assertArrayEquals(new double[] { 0.001, 0.0 }, objective.getBestParameters(), 0.0);
    }
}
