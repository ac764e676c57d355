package net.shortrates.marketdata.curves;

import java.io.IOException;
import java.io.Writer;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

import net.shortrates.montecarlo.process.PathEnsemble;

/**
 * Writes curves and ensemble summaries as separated values, e.g. for an external plotting tool.
 */
public class CurveCsvWriter {
	private static final DecimalFormat formatterTime	= new DecimalFormat("##0.00000", new DecimalFormatSymbols(Locale.ENGLISH));
	private static final DecimalFormat formatterRate	= new DecimalFormat("0.0000000000;-0.0000000000", new DecimalFormatSymbols(Locale.ENGLISH));

	private final String separator;

	public CurveCsvWriter() {
		this(",");
	}

	public CurveCsvWriter(String separator) {
		this.separator = separator;
	}

	public void writeSpotCurve(SpotCurve spotCurve, Writer writer) throws IOException {
		writer.write("maturityInSteps" + separator + "maturity" + separator + "spotRate" + separator + "discountFactor" + "\n");
		for(int maturity = 1; maturity <= spotCurve.getNumberOfMaturities(); maturity++) {
			writer.write(maturity
					+ separator + formatTime(spotCurve.getMaturity(maturity))
					+ separator + formatRate(spotCurve.getSpotRate(maturity))
					+ separator + formatRate(spotCurve.getDiscountFactor(maturity)) + "\n");
		}
		writer.flush();
	}

	public void writeComparison(ObservedCurve observedCurve, SpotCurve fittedCurve, Writer writer) throws IOException {
		writer.write("maturityInSteps" + separator + "maturity" + separator + "observed" + separator + "fitted" + separator + "error" + "\n");
		for(int maturity : observedCurve.getMaturities()) {
			double observed = observedCurve.getYield(maturity);
			double fitted = fittedCurve.getSpotRate(maturity);
			writer.write(maturity
					+ separator + formatTime(fittedCurve.getMaturity(maturity))
					+ separator + formatRate(observed)
					+ separator + formatRate(fitted)
					+ separator + formatRate(fitted - observed) + "\n");
		}
		writer.flush();
	}

	public void writeEnsembleSummary(PathEnsemble ensemble, Writer writer) throws IOException {
		writer.write("timeIndex" + separator + "time" + separator + "mean" + separator + "standardDeviation" + "\n");
		for(int timeIndex = 0; timeIndex < ensemble.getNumberOfTimes(); timeIndex++) {
			writer.write(timeIndex
					+ separator + formatTime(ensemble.getTimeDiscretization().getTime(timeIndex))
					+ separator + formatRate(ensemble.getAverage(timeIndex))
					+ separator + formatRate(ensemble.getStandardDeviation(timeIndex)) + "\n");
		}
		writer.flush();
	}

	private static String formatTime(double time) {
		synchronized (formatterTime) {
			return formatterTime.format(time);
		}
	}

	private static String formatRate(double rate) {
		if(Double.isInfinite(rate) || Double.isNaN(rate)) return Double.toString(rate);
		synchronized (formatterRate) {
			return formatterRate.format(rate);
		}
	}
}
