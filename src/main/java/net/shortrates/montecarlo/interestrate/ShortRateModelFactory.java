package net.shortrates.montecarlo.interestrate;

import java.util.Map;

import net.shortrates.configuration.PropertyValues;
import net.shortrates.montecarlo.interestrate.models.BrennanSchwartzModel;
import net.shortrates.montecarlo.interestrate.models.CIRModel;
import net.shortrates.montecarlo.interestrate.models.DothanModel;
import net.shortrates.montecarlo.interestrate.models.HullWhiteModel;
import net.shortrates.montecarlo.interestrate.models.MertonModel;
import net.shortrates.montecarlo.interestrate.models.TwoFactorGaussianModel;
import net.shortrates.montecarlo.interestrate.models.VasicekModel;

/**
 * Creates short rate models from a map of named parameters.
 *
 * The keys are <code>alpha</code>, <code>beta</code>, <code>sigma</code> for the one factor models and
 * <code>alphaX</code>, <code>betaX</code>, <code>sigmaX</code>, <code>alphaY</code>, <code>betaY</code>, <code>sigmaY</code>,
 * <code>initialX</code>, <code>initialY</code> and (optional) <code>correlation</code> for the two factor model.
 * For the Hull-White model <code>alpha</code> is a vector with one entry per time step, given as a <code>double[]</code>
 * or as a comma separated list.
 */
public class ShortRateModelFactory {

	private ShortRateModelFactory() {
	}

	/**
	 * @param modelType The model variant.
	 * @param initialRate The initial short rate (ignored for the two factor model, where the initial state is given by the factors).
	 * @param numberOfTimeSteps The number of time steps of the simulation grid.
	 * @param parameters The model parameters.
	 * @return The model.
	 * @throws IllegalArgumentException If a parameter is missing or invalid.
	 */
	public static ShortRateModelInterface createModel(ModelType modelType, double initialRate, int numberOfTimeSteps, Map<String, ?> parameters) {
		switch (modelType) {
		case MERTON:
			return new MertonModel(initialRate, PropertyValues.getDouble(parameters, "alpha"), PropertyValues.getDouble(parameters, "sigma"));
		case VASICEK:
			return new VasicekModel(initialRate, PropertyValues.getDouble(parameters, "alpha"), PropertyValues.getDouble(parameters, "beta"), PropertyValues.getDouble(parameters, "sigma"));
		case DOTHAN:
			return new DothanModel(initialRate, PropertyValues.getDouble(parameters, "sigma"));
		case BRENNAN_SCHWARTZ:
			return new BrennanSchwartzModel(initialRate, PropertyValues.getDouble(parameters, "alpha"), PropertyValues.getDouble(parameters, "beta"), PropertyValues.getDouble(parameters, "sigma"));
		case CIR:
			return new CIRModel(initialRate, PropertyValues.getDouble(parameters, "alpha"), PropertyValues.getDouble(parameters, "beta"), PropertyValues.getDouble(parameters, "sigma"));
		case TWO_FACTOR_GAUSSIAN:
			return new TwoFactorGaussianModel(
					PropertyValues.getDouble(parameters, "initialX"), PropertyValues.getDouble(parameters, "initialY"),
					PropertyValues.getDouble(parameters, "alphaX"), PropertyValues.getDouble(parameters, "betaX"), PropertyValues.getDouble(parameters, "sigmaX"),
					PropertyValues.getDouble(parameters, "alphaY"), PropertyValues.getDouble(parameters, "betaY"), PropertyValues.getDouble(parameters, "sigmaY"),
					PropertyValues.getDouble(parameters, "correlation", TwoFactorGaussianModel.DEFAULT_CORRELATION));
		case HULL_WHITE:
			double[] alpha = PropertyValues.getDoubleArray(parameters, "alpha");
			if(alpha.length != numberOfTimeSteps) {
				throw new IllegalArgumentException("Hull-White mean level vector must have " + numberOfTimeSteps + " entries, got " + alpha.length + ".");
			}
			return new HullWhiteModel(initialRate, alpha, PropertyValues.getDouble(parameters, "beta"), PropertyValues.getDouble(parameters, "sigma"));
		default:
			throw new IllegalArgumentException("Model type " + modelType + " not supported.");
		}
	}

	public static ShortRateModelInterface createModel(String modelName, double initialRate, int numberOfTimeSteps, Map<String, ?> parameters) {
		return createModel(ModelType.of(modelName), initialRate, numberOfTimeSteps, parameters);
	}
}
