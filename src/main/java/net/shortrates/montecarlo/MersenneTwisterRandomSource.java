package net.shortrates.montecarlo;

import org.apache.commons.math3.random.MersenneTwister;

/**
 * Random source backed by a Mersenne Twister, see {@link MersenneTwister}.
 *
 * Instances are not thread safe. Use one instance per simulation.
 */
public class MersenneTwisterRandomSource implements RandomSourceInterface {

	private final int				seed;
	private final MersenneTwister	mersenneTwister;

	public MersenneTwisterRandomSource(int seed) {
		this.seed = seed;
		this.mersenneTwister = new MersenneTwister(seed);
	}

	@Override
	public double nextNormal() {
		return mersenneTwister.nextGaussian();
	}

	@Override
	public double[] nextCorrelatedPair(double rho) {
		if(!(Math.abs(rho) <= 1.0)) {
			throw new IllegalArgumentException("Correlation must be within [-1, 1]: " + rho + ".");
		}
		double w1 = nextNormal();
		double w2 = nextNormal();
		return new double[] { w1, rho * w1 + Math.sqrt(1.0 - rho * rho) * w2 };
	}

	@Override
	public void reset() {
		mersenneTwister.setSeed(seed);
	}

	@Override
	public int getSeed() {
		return seed;
	}

	@Override
	public String toString() {
		return "MersenneTwisterRandomSource [seed=" + seed + "]";
	}
}
