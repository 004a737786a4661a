package com.brewuv.parse;

import com.brewuv.model.ParameterRow;
import com.brewuv.model.ParameterTable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads parameter files ({@code par_yy.bid}): {@code day;albedo;alpha;beta;cloud} per line.
 * <p>
 * Empty albedo, alpha or beta fields take the value of the closest previous line that had one;
 * the first line must define all three. Cloud cover is optional and never inherited.
 */
public final class ParameterFileParser {
    private static final int FIELD_COUNT = 5;

    public ParameterTable parse(Path path) throws IOException {
        return parse(path.getFileName().toString(), InputText.read(path));
    }

    public ParameterTable parse(String fileName, String content) {
        return new ParameterTable(parseRows(fileName, content));
    }

    /**
     * Rows in file order, with carry-forward applied.
     */
    public List<ParameterRow> parseRows(String fileName, String content) {
        List<ParameterRow> rows = new ArrayList<>();
        Double albedo = null;
        Double alpha = null;
        Double beta = null;

        List<String> lines = InputText.lines(content);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            int lineNumber = i + 1;
            String[] fields = line.split(";", -1);
            if (fields.length != FIELD_COUNT) {
                throw new MalformedInputException(fileName, lineNumber,
                        "expected " + FIELD_COUNT + " ';'-separated fields but found " + fields.length);
            }
            int day;
            try {
                day = Integer.parseInt(fields[0].trim());
            } catch (NumberFormatException e) {
                throw new MalformedInputException(fileName, lineNumber, "invalid day '" + fields[0] + "'", e);
            }
            albedo = carry(fileName, lineNumber, fields[1], albedo, "albedo");
            alpha = carry(fileName, lineNumber, fields[2], alpha, "alpha");
            beta = carry(fileName, lineNumber, fields[3], beta, "beta");
            Double cloud = fields[4].trim().isEmpty()
                    ? null
                    : InputText.parseDouble(fileName, lineNumber, fields[4], "cloud cover");
            rows.add(new ParameterRow(day, albedo, alpha, beta, cloud));
        }
        if (rows.isEmpty()) {
            throw new MalformedInputException(fileName, 0, "parameter file has no rows");
        }
        return rows;
    }

    private static Double carry(String fileName, int lineNumber, String raw, Double previous, String name) {
        if (raw.trim().isEmpty()) {
            if (previous == null) {
                throw new MalformedInputException(fileName, lineNumber, name + " must be defined on the first line");
            }
            return previous;
        }
        return InputText.parseDouble(fileName, lineNumber, raw, name);
    }
}
