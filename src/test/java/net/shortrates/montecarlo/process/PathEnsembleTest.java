package net.shortrates.montecarlo.process;

import net.finmath.time.TimeDiscretization;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class PathEnsembleTest {

    private final double[][] values = {
            { 0.01, 0.01, 0.01 },
            { 0.02, 0.00, 0.04 },
            { 0.03, -0.01, 0.05 }
    };

    private final PathEnsemble ensemble = new PathEnsemble(new TimeDiscretization(0.0, 3, 0.5), values);

    @Test
    public void testAccessors() {
        assertEquals(3, ensemble.getNumberOfTimes());
        assertEquals(3, ensemble.getNumberOfPaths());
        assertEquals(0.5, ensemble.getTimeStep(), 1E-12);
        assertEquals(0.02, ensemble.getAverage(1), 1E-15);
        assertEquals(-0.01, ensemble.getMinimum(), 0.0);
        assertEquals(0, ensemble.getNumberOfFactorPaths());
    }

    @Test
    public void testThatEnsembleIsNotAliased() {
        values[1][1] = 42.0;
        ensemble.getValues()[1][1] = 43.0;

        assertEquals(0.0, ensemble.getValue(1, 1), 0.0);
    }

    @Test
    public void testThatProcessValueCarriesTheRow() {
        assertEquals(1.0, ensemble.getProcessValue(2).getFiltrationTime(), 1E-12);
        assertEquals(0.05, ensemble.getProcessValue(2).getMax(), 0.0);
        assertEquals(ensemble.getProcessValue(1).getStandardDeviation(), ensemble.getStandardDeviation(1), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testThatRowCountMustMatchTimeDiscretization() {
        new PathEnsemble(new TimeDiscretization(0.0, 4, 0.5), values);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testThatRaggedMatrixIsRejected() {
        new PathEnsemble(new TimeDiscretization(0.0, 2, 0.5), new double[][] { { 0.01, 0.02 }, { 0.01 } });
    }
}
