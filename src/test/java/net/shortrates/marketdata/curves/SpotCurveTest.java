package net.shortrates.marketdata.curves;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SpotCurveTest {

    @Test
    public void testThatDiscountFactorIsConsistentWithSpotRate() {
        SpotCurve curve = new SpotCurve(0.5, new double[] { 0.02, 0.025, 0.03 });

        assertEquals(3, curve.getNumberOfMaturities());
        assertEquals(1.5, curve.getMaturity(3), 0.0);
        assertEquals(Math.exp(-0.03 * 1.5), curve.getDiscountFactor(3), 1E-15);
        assertTrue(curve.isFinite());
    }

    @Test
    public void testThatInfiniteRatesAreFlagged() {
        SpotCurve curve = new SpotCurve(0.5, new double[] { 0.02, Double.POSITIVE_INFINITY });

        assertFalse(curve.isFinite());
        assertEquals(0.0, curve.getDiscountFactor(2), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testThatMaturityBeyondCurveIsRejected() {
        new SpotCurve(0.5, new double[] { 0.02 }).getSpotRate(2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testThatNonPositiveTimeStepIsRejected() {
        new SpotCurve(0.0, new double[] { 0.02 });
    }
}
