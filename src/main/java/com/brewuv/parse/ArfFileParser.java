package com.brewuv.parse;

import com.brewuv.model.AngularResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads angular response files ({@code arf_*bid.dat}). Lines starting with {@code %} are comments,
 * the first column is the zenith angle and the response is taken from a configurable column.
 */
public final class ArfFileParser {
    private static final Logger log = LogManager.getLogger(ArfFileParser.class);

    public static final int DEFAULT_COLUMN = 3;

    private final int column;

    public ArfFileParser() {
        this(DEFAULT_COLUMN);
    }

    public ArfFileParser(int column) {
        if (column < 1) {
            throw new IllegalArgumentException("arf value column must be >= 1, got " + column);
        }
        this.column = column;
    }

    public AngularResponse parse(Path path) throws IOException {
        return parse(path.getFileName().toString(), InputText.read(path));
    }

    public AngularResponse parse(String fileName, String content) {
        List<Double> angles = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        boolean shortLineReported = false;

        List<String> lines = InputText.lines(content);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("%")) {
                continue;
            }
            int lineNumber = i + 1;
            String[] parts = line.split("\\s+");
            double angle = InputText.parseDouble(fileName, lineNumber, parts[0], "zenith angle");
            if (angle < 0 || angle > 90) {
                throw new MalformedInputException(fileName, lineNumber, "zenith angle must be between 0 and 90, found " + angle);
            }
            if (angles.isEmpty() && angle != 0.0) {
                throw new MalformedInputException(fileName, lineNumber, "first zenith angle must be 0, found " + angle);
            }
            if (!angles.isEmpty() && angle <= angles.get(angles.size() - 1)) {
                throw new MalformedInputException(fileName, lineNumber,
                        "zenith angle " + angle + " is not above the previous one");
            }
            String raw;
            if (parts.length <= column) {
                if (!shortLineReported) {
                    log.warn("{}:{} has only {} columns, reading the last column instead of column {}",
                            fileName, lineNumber, parts.length, column);
                    shortLineReported = true;
                }
                raw = parts[parts.length - 1];
            } else {
                raw = parts[column];
            }
            angles.add(angle);
            values.add(InputText.parseDouble(fileName, lineNumber, raw, "angular response"));
        }

        if (angles.isEmpty()) {
            throw new MalformedInputException(fileName, 0, "no angular response values");
        }
        if (angles.get(angles.size() - 1) < 90.0) {
            angles.add(90.0);
            values.add(0.0);
        }

        double[] a = new double[angles.size()];
        double[] v = new double[values.size()];
        for (int i = 0; i < a.length; i++) {
            a[i] = angles.get(i);
            v[i] = values.get(i);
        }
        return new AngularResponse(a, v);
    }
}
