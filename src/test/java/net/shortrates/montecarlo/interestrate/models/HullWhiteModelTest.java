package net.shortrates.montecarlo.interestrate.models;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class HullWhiteModelTest {

    @Test
    public void testThatStepUsesMeanLevelOfProducedTimeIndex() {
        double[] alpha = { 0.10, 0.02, 0.04 };
        HullWhiteModel model = new HullWhiteModel(0.015, alpha, 0.5, 0.01);
        double dt = 0.25;

        assertEquals(0.015 + 0.5 * (0.02 - 0.015) * dt, model.getNextRate(0.015, dt, 0.0, 1), 1E-15);
        assertEquals(0.015 + 0.5 * (0.04 - 0.015) * dt, model.getNextRate(0.015, dt, 0.0, 2), 1E-15);
    }

    @Test
    public void testThatParameterVectorHoldsSpeedVolatilityAndMeanLevels() {
        HullWhiteModel model = new HullWhiteModel(0.015, new double[] { 0.01, 0.02, 0.03 }, 0.5, 0.01);

        assertArrayEquals(new double[] { 0.5, 0.01, 0.01, 0.02, 0.03 }, model.getParameter(), 0.0);
        assertEquals("alpha[2]", model.getParameterNames()[4]);

        HullWhiteModel clone = model.getCloneWithModifiedParameters(new double[] { -0.5, 0.02, 0.03, 0.02, 0.01 });
        assertEquals(0.0, clone.getBeta(), 0.0);
        assertArrayEquals(new double[] { 0.03, 0.02, 0.01 }, clone.getAlpha(), 0.0);
    }

    @Test
    public void testFlatMeanLevel() {
        HullWhiteModel model = new HullWhiteModel(0.015, 0.03, 360, 0.5, 0.01);

        assertEquals(360, model.getNumberOfTimeSteps());
        assertEquals(362, model.getParameter().length);
        assertEquals(0.03, model.getAlpha()[359], 0.0);
    }

    @Test
    public void testThatMeanLevelVectorMustMatchGrid() {
        HullWhiteModel model = new HullWhiteModel(0.015, 0.03, 59, 0.5, 0.01);
        model.checkNumberOfTimeSteps(59);
        try {
            model.checkNumberOfTimeSteps(60);
            fail();
        }
        catch(IllegalArgumentException e) {
            assertEquals("Hull-White mean level vector must have 60 entries, got 59.", e.getMessage());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testThatEmptyMeanLevelVectorIsRejected() {
        new HullWhiteModel(0.015, new double[0], 0.5, 0.01);
    }
}
