package net.shortrates.montecarlo.interestrate.models;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import java.util.Arrays;
import java.util.Collection;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

@RunWith(Parameterized.class)
public class OneFactorShortRateModelStepTest {

    private static final double ALPHA = 0.03;
    private static final double BETA = 0.5;
    private static final double SIGMA = 0.02;
    private static final double DT = 1.0 / 12.0;

    private final AbstractOneFactorShortRateModel model;
    private final double priorRate;
    private final double randomDraw;
    private final double expectedRate;

    @Parameterized.Parameters(name = "{index}: {0}, r={1}, z={2}")
    public static Collection<Object[]> data() {
        double sqrtDt = Math.sqrt(DT);
        return Arrays.asList(new Object[][]{
                {new MertonModel(0.015, ALPHA, SIGMA), 0.015, 0.7, 0.015 + ALPHA * DT + SIGMA * 0.7 * sqrtDt},
                {new MertonModel(0.015, ALPHA, SIGMA), -0.01, -1.3, -0.01 + ALPHA * DT - SIGMA * 1.3 * sqrtDt},
                {new VasicekModel(0.015, ALPHA, BETA, SIGMA), 0.015, 0.7, 0.015 + BETA * (ALPHA - 0.015) * DT + SIGMA * 0.7 * sqrtDt},
                {new VasicekModel(0.015, ALPHA, BETA, SIGMA), -0.02, 0.0, -0.02 + BETA * (ALPHA + 0.02) * DT},
                {new DothanModel(0.015, SIGMA), 0.015, 0.7, 0.015 + SIGMA * 0.015 * 0.7 * sqrtDt},
                {new BrennanSchwartzModel(0.015, ALPHA, BETA, SIGMA), 0.04, -0.4, 0.04 + BETA * (ALPHA - 0.04) * DT + SIGMA * 0.04 * -0.4 * sqrtDt},
                {new CIRModel(0.015, ALPHA, BETA, SIGMA), 0.04, -0.4, 0.04 + BETA * (ALPHA - 0.04) * DT + SIGMA * Math.sqrt(0.04) * -0.4 * sqrtDt},
                {new CIRModel(0.015, ALPHA, BETA, SIGMA), 0.0, 2.0, BETA * ALPHA * DT},
                {new CIRModel(0.015, ALPHA, BETA, SIGMA), -0.001, 2.0, 0.0}
        });
    }

    public OneFactorShortRateModelStepTest(AbstractOneFactorShortRateModel model, double priorRate, double randomDraw, double expectedRate) {
        this.model = model;
        this.priorRate = priorRate;
        this.randomDraw = randomDraw;
        this.expectedRate = expectedRate;
    }

    @Test
    public void testEulerStep() {
        assertEquals(expectedRate, model.getNextRate(priorRate, DT, randomDraw, 1), 1E-15);
        assertArrayEquals(new double[] { expectedRate }, model.getNextState(new double[] { priorRate }, DT, new double[] { randomDraw }, 1), 1E-15);
    }

    @Test
    public void testThatStepIsPure() {
        double[] priorState = { priorRate };
        double[] randomDraws = { randomDraw };
        double[] first = model.getNextState(priorState, DT, randomDraws, 5);
        double[] second = model.getNextState(priorState, DT, randomDraws, 5);

        assertArrayEquals(first, second, 0.0);
        assertEquals(priorRate, priorState[0], 0.0);
    }

    @Test
    public void testThatParametersRoundTripThroughClone() {
        double[] parameters = model.getParameter();
        AbstractShortRateModel clone = (AbstractShortRateModel) model.getCloneWithModifiedParameters(parameters);

        assertArrayEquals(parameters, clone.getParameter(), 0.0);
        assertArrayEquals(model.getInitialState(), clone.getInitialState(), 0.0);
        assertEquals(parameters.length, model.getParameterNames().length);
    }

    @Test
    public void testThatInitialRateCanBeModified() {
        AbstractOneFactorShortRateModel clone = model.getCloneWithModifiedInitialState(new double[] { 0.042 });

        assertEquals(0.042, clone.getInitialRate(), 0.0);
        assertEquals(model.getModelType(), clone.getModelType());
        assertArrayEquals(model.getParameter(), clone.getParameter(), 0.0);
    }
}
