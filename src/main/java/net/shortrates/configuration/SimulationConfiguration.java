package net.shortrates.configuration;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import net.finmath.time.TimeDiscretization;
import net.finmath.time.TimeDiscretizationInterface;
import net.shortrates.montecarlo.MersenneTwisterRandomSource;
import net.shortrates.montecarlo.RandomSourceInterface;
import net.shortrates.montecarlo.interestrate.ModelType;
import net.shortrates.montecarlo.interestrate.ShortRateModelFactory;
import net.shortrates.montecarlo.interestrate.ShortRateModelInterface;
import net.shortrates.montecarlo.process.PathSimulator;

/**
 * The configuration of a simulation or calibration run, given as a map of named properties.
 *
 * The keys are (<code>String</code>s):
 * <ul>
 * 	<li><tt>horizon</tt>: the simulation horizon in years, default 5.0.</li>
 * 	<li><tt>numberOfTimeSteps</tt>: the number of time steps of the simulation grid, default 60.</li>
 * 	<li><tt>numberOfPaths</tt>: the number of Monte Carlo paths, default 10000.</li>
 * 	<li><tt>initialRate</tt>: the initial short rate, default 0.015.</li>
 * 	<li><tt>seed</tt>: the seed of the random source, default 31415.</li>
 * 	<li><tt>model</tt>: the name of the {@link ModelType}, default <code>VASICEK</code>.</li>
 * 	<li>the model parameters, see {@link ShortRateModelFactory}.</li>
 * </ul>
 * All other keys are kept and may be used as calibration parameters.
 *
 * The configuration is validated on construction.
 */
public class SimulationConfiguration {

	private final Map<String, Object> properties;

	private final double	horizon;
	private final int		numberOfTimeSteps;
	private final int		numberOfPaths;
	private final double	initialRate;
	private final int		seed;
	private final ModelType	modelType;

	public SimulationConfiguration(Map<String, ?> properties) {
		this.properties = Collections.unmodifiableMap(new HashMap<String, Object>(properties != null ? properties : Collections.<String, Object>emptyMap()));

		horizon				= PropertyValues.getDouble(this.properties, "horizon", 5.0);
		numberOfTimeSteps	= PropertyValues.getInteger(this.properties, "numberOfTimeSteps", 60);
		numberOfPaths		= PropertyValues.getInteger(this.properties, "numberOfPaths", 10000);
		initialRate			= PropertyValues.getDouble(this.properties, "initialRate", 0.015);
		seed				= PropertyValues.getInteger(this.properties, "seed", 31415);
		modelType			= ModelType.of(PropertyValues.getString(this.properties, "model", ModelType.VASICEK.name()));

		if(!(horizon > 0) || Double.isInfinite(horizon)) {
			throw new IllegalArgumentException("Horizon must be positive: " + horizon + ".");
		}
		if(numberOfTimeSteps <= 0) {
			throw new IllegalArgumentException("Number of time steps must be positive: " + numberOfTimeSteps + ".");
		}
		if(numberOfPaths <= 0) {
			throw new IllegalArgumentException("Number of paths must be positive: " + numberOfPaths + ".");
		}
		if(Double.isNaN(initialRate) || Double.isInfinite(initialRate)) {
			throw new IllegalArgumentException("Initial rate must be finite: " + initialRate + ".");
		}
	}

	/**
	 * Creates a configuration from properties, e.g. read from a <code>.properties</code> file.
	 *
	 * @param properties The properties.
	 * @return The configuration.
	 */
	public static SimulationConfiguration fromProperties(Properties properties) {
		Map<String, Object> map = new HashMap<String, Object>();
		for(String key : properties.stringPropertyNames()) {
			map.put(key, properties.getProperty(key));
		}
		return new SimulationConfiguration(map);
	}

	public static SimulationConfiguration load(Path file) throws IOException {
		Properties properties = new Properties();
		try(Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			properties.load(reader);
		}
		return fromProperties(properties);
	}

	/**
	 * Returns the equidistant simulation grid <i>0, &Delta;t, ..., N &Delta;t</i> with <i>&Delta;t = horizon / N</i>.
	 *
	 * @return The time discretization.
	 */
	public TimeDiscretizationInterface getTimeDiscretization() {
		return new TimeDiscretization(0.0, numberOfTimeSteps, horizon / numberOfTimeSteps);
	}

	/**
	 * Creates the configured model. Model parameters are validated against the grid size.
	 *
	 * @return The model.
	 */
	public ShortRateModelInterface createModel() {
		return ShortRateModelFactory.createModel(modelType, initialRate, numberOfTimeSteps, properties);
	}

	public RandomSourceInterface createRandomSource() {
		return new MersenneTwisterRandomSource(seed);
	}

	public PathSimulator createSimulator() {
		return new PathSimulator(createRandomSource());
	}

	public double getHorizon() {
		return horizon;
	}

	public int getNumberOfTimeSteps() {
		return numberOfTimeSteps;
	}

	public double getTimeStep() {
		return horizon / numberOfTimeSteps;
	}

	public int getNumberOfPaths() {
		return numberOfPaths;
	}

	public double getInitialRate() {
		return initialRate;
	}

	public int getSeed() {
		return seed;
	}

	public ModelType getModelType() {
		return modelType;
	}

	public Map<String, Object> getProperties() {
		return properties;
	}

	@Override
	public String toString() {
		return "SimulationConfiguration [model=" + modelType + ", horizon=" + horizon + ", numberOfTimeSteps=" + numberOfTimeSteps
				+ ", numberOfPaths=" + numberOfPaths + ", initialRate=" + initialRate + ", seed=" + seed + "]";
	}
}
