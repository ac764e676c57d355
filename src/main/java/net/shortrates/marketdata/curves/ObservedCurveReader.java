package net.shortrates.marketdata.curves;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads an {@link ObservedCurve} from lines of the form <code>maturityInSteps,yield</code>.
 *
 * Fields may be separated by comma, semicolon, tab or blanks. Blank lines and lines starting with
 * <code>#</code> are ignored. The first line may be a header, i.e. a line none of whose fields is a number.
 */
public class ObservedCurveReader {

	private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?|[+-]?(NaN|Infinity)");

	private ObservedCurveReader() {
	}

	public static ObservedCurve read(Path file) throws IOException {
		try(Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return read(reader);
		}
	}

	public static ObservedCurve read(Reader reader) throws IOException {
		Map<Integer, Double> yields = new LinkedHashMap<>();
		BufferedReader bufferedReader = new BufferedReader(reader);
		boolean isFirstDataLine = true;
		int lineNumber = 0;
		String line;
		while((line = bufferedReader.readLine()) != null) {
			lineNumber++;
			line = line.trim();
			if(line.isEmpty() || line.startsWith("#")) continue;

			String[] fields = line.split("[,;\\t ]+");
			if(fields.length != 2) {
				throw new IllegalArgumentException("Line " + lineNumber + ": expected maturity and yield, got '" + line + "'.");
			}
			int maturity;
			double yield;
			try {
				maturity = Integer.parseInt(fields[0]);
				yield = Double.parseDouble(fields[1]);
			}
			catch(NumberFormatException e) {
				if(isFirstDataLine && !isNumber(fields[0]) && !isNumber(fields[1])) {
					// Header
					isFirstDataLine = false;
					continue;
				}
				throw new IllegalArgumentException("Line " + lineNumber + ": cannot parse '" + line + "'.", e);
			}
			isFirstDataLine = false;
			if(yields.put(maturity, yield) != null) {
				throw new IllegalArgumentException("Line " + lineNumber + ": duplicate maturity " + maturity + ".");
			}
		}
		return new ObservedCurve(yields);
	}

	private static boolean isNumber(String field) {
		return NUMBER.matcher(field).matches();
	}
}
