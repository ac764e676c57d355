package net.shortrates;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

import net.finmath.exception.CalculationException;
import net.shortrates.calibration.CalibrationResult;
import net.shortrates.calibration.ShortRateModelCalibrator;
import net.shortrates.configuration.SimulationConfiguration;
import net.shortrates.marketdata.curves.CurveCsvWriter;
import net.shortrates.marketdata.curves.ObservedCurve;
import net.shortrates.marketdata.curves.ObservedCurveReader;
import net.shortrates.marketdata.curves.SpotCurve;
import net.shortrates.montecarlo.interestrate.DiscountCurveEstimator;
import net.shortrates.montecarlo.interestrate.ShortRateModelInterface;
import net.shortrates.montecarlo.process.PathEnsemble;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Command line entry point.
 *
 * <code>ShortRateCalibrationMain configuration.properties [observed.csv]</code>
 *
 * Without an observed curve the configured model is simulated and its spot curve, followed by the mean and standard
 * deviation of the short rate per time step, is written to standard out.
 * With an observed curve the configured model is calibrated to it (the configured parameters being the initial guess)
 * and the fitted parameters together with the comparison of observed and fitted yields are written.
 */
public class ShortRateCalibrationMain {

	private static final Logger logger = LogManager.getLogger(ShortRateCalibrationMain.class);

	public static void main(String[] args) throws IOException, CalculationException {
		PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
		int status = run(args, out);
		out.flush();
		if(status != 0) {
			System.exit(status);
		}
	}

	static int run(String[] args, PrintWriter out) throws IOException, CalculationException {
		if(args.length < 1 || args.length > 2) {
			out.println("Usage: " + ShortRateCalibrationMain.class.getSimpleName() + " <configuration.properties> [observed.csv]");
			return 1;
		}

		SimulationConfiguration configuration = SimulationConfiguration.load(Paths.get(args[0]));
		logger.info("Loaded {}.", configuration);

		ShortRateModelInterface model = configuration.createModel();
		if(args.length == 1) {
			simulate(configuration, model, out);
		}
		else {
			calibrate(configuration, model, Paths.get(args[1]), out);
		}
		return 0;
	}

	private static void simulate(SimulationConfiguration configuration, ShortRateModelInterface model, Writer out) throws IOException {
		PathEnsemble ensemble = configuration.createSimulator().simulate(model, configuration.getTimeDiscretization(), configuration.getNumberOfPaths());
		SpotCurve spotCurve = new DiscountCurveEstimator().estimate(ensemble);

		logger.info("Simulated {} paths of {} model, spot rate at {} years: {}.", ensemble.getNumberOfPaths(), model.getModelType(),
				spotCurve.getMaturity(spotCurve.getNumberOfMaturities()), spotCurve.getSpotRate(spotCurve.getNumberOfMaturities()));

		CurveCsvWriter curveCsvWriter = new CurveCsvWriter();
		curveCsvWriter.writeSpotCurve(spotCurve, out);
		out.write("\n");
		curveCsvWriter.writeEnsembleSummary(ensemble, out);
	}

	private static void calibrate(SimulationConfiguration configuration, ShortRateModelInterface model, Path observedCurveFile, PrintWriter out) throws IOException, CalculationException {
		ObservedCurve observedCurve = ObservedCurveReader.read(observedCurveFile);

		ShortRateModelCalibrator calibrator = new ShortRateModelCalibrator(configuration.getTimeDiscretization(), configuration.getNumberOfPaths(), configuration.getSeed(), configuration.getProperties());
		CalibrationResult result = calibrator.calibrate(model, observedCurve);

		String[] names = result.getCalibratedModel().getParameterNames();
		double[] parameters = result.getParameters();
		logger.info("Calibrated {} model: {}", model.getModelType(), parameters.length <= 10 ? Arrays.toString(parameters) : parameters.length + " parameters");

		out.println("# model: " + model.getModelType());
		for(int i = 0; i < parameters.length; i++) {
			out.println("# " + names[i] + " = " + parameters[i]);
		}
		out.println("# objective: " + result.getObjectiveValue() + " (initial " + result.getInitialObjectiveValue() + ")");
		out.println("# converged: " + result.isConverged());
		out.println("# evaluations: " + result.getNumberOfEvaluations());
		new CurveCsvWriter().writeComparison(observedCurve, result.getFittedCurve(), out);
	}
}
