package com.brewuv.parse;

import com.brewuv.model.CalibrationRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads UVR calibration files: one {@code wavelength(Å) response} pair per line.
 */
public final class CalibrationFileParser {

    public CalibrationRecord parse(Path path) throws IOException {
        return parse(path.getFileName().toString(), InputText.read(path));
    }

    public CalibrationRecord parse(String fileName, String content) {
        List<double[]> rows = new ArrayList<>();
        List<String> lines = InputText.lines(content);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            int lineNumber = i + 1;
            String[] parts = line.split("\\s+");
            if (parts.length != 2) {
                throw new MalformedInputException(fileName, lineNumber,
                        "expected 2 values but found " + parts.length + ": '" + line + "'");
            }
            double wavelength = InputText.parseDouble(fileName, lineNumber, parts[0], "wavelength") / 10.0;
            double value = InputText.parseDouble(fileName, lineNumber, parts[1], "calibration value");
            if (!rows.isEmpty() && wavelength <= rows.get(rows.size() - 1)[0]) {
                throw new MalformedInputException(fileName, lineNumber,
                        "wavelength " + wavelength + " nm is not above the previous one");
            }
            rows.add(new double[]{wavelength, value});
        }
        if (rows.isEmpty()) {
            throw new MalformedInputException(fileName, 0, "no calibration values");
        }
        double[] wavelengths = new double[rows.size()];
        double[] values = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            wavelengths[i] = rows.get(i)[0];
            values[i] = rows.get(i)[1];
        }
        return new CalibrationRecord(wavelengths, values);
    }
}
