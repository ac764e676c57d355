package net.shortrates.montecarlo;

/**
 * Interface for a seedable source of standard normal draws.
 *
 * Implementations must reproduce exactly the same sequence of draws after {@link #reset()} or when
 * constructed with the same seed. Simulations reset the source at the start of every trajectory loop,
 * such that objective evaluations of a calibration are compared on identical paths.
 */
public interface RandomSourceInterface {

	/**
	 * @return The next independent draw from the standard normal distribution.
	 */
	double nextNormal();

	/**
	 * Returns two standard normal draws with correlation <code>rho</code>, built from independent draws
	 * <i>w<sub>1</sub>, w<sub>2</sub></i> as <i>(w<sub>1</sub>, &rho; w<sub>1</sub> + &radic;(1-&rho;<sup>2</sup>) w<sub>2</sub>)</i>.
	 *
	 * @param rho The correlation, |rho| &le; 1.
	 * @return Array of length 2.
	 */
	double[] nextCorrelatedPair(double rho);

	/**
	 * Re-seeds the source with its initial seed.
	 */
	void reset();

	int getSeed();
}
