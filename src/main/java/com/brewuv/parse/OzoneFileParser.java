package com.brewuv.parse;

import com.brewuv.model.OzoneRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the ozone summaries and the instrument model of a B file ({@code Bdddyy.bid}).
 */
public final class OzoneFileParser {
    private static final Logger log = LogManager.getLogger(OzoneFileParser.class);

    private static final Pattern SUMMARY = Pattern.compile(
            "summary (?<hours>\\d\\d):(?<minutes>\\d\\d):(?<seconds>\\d\\d)\\s+"
                    + "[A-Z]{3}\\s+\\d\\d/\\s*\\d\\d\\s+"
                    + "\\S+\\s+"
                    + "(?<airMass>\\S+)\\s+"
                    + "\\S+\\s+"
                    + "ds\\s+"
                    + "(?:\\S+\\s+){8}"
                    + "(?<ozone>\\S+)\\s+"
                    + "(?:\\S+\\s+){7}"
                    + "(?<ozoneStd>\\S+)"
    );
    private static final Pattern INSTRUMENT = Pattern.compile("inst\\s+(?:\\S+\\s+){22}(?<brewerModel>\\S+)(?:\\s+|$)");

    static final double MAX_AIR_MASS = 3.5;
    static final double MAX_OZONE_STD = 2.5;

    public OzoneRecord parse(Path path) throws IOException {
        return parse(path.getFileName().toString(), InputText.read(path));
    }

    public OzoneRecord parse(String fileName, String content) {
        List<Double> times = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        String brewerModel = null;
        int skipped = 0;

        List<String> lines = InputText.lines(content);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            int lineNumber = i + 1;
            Matcher summary = SUMMARY.matcher(line);
            if (summary.lookingAt()) {
                double airMass = InputText.parseDouble(fileName, lineNumber, summary.group("airMass"), "air mass");
                double ozoneStd = InputText.parseDouble(fileName, lineNumber, summary.group("ozoneStd"), "ozone std");
                if (airMass > MAX_AIR_MASS || ozoneStd > MAX_OZONE_STD) {
                    skipped++;
                    continue;
                }
                int hours = Integer.parseInt(summary.group("hours"));
                int minutes = Integer.parseInt(summary.group("minutes"));
                int seconds = Integer.parseInt(summary.group("seconds"));
                times.add(((hours * 3600 + minutes * 60 + seconds) % 86400) / 60.0);
                values.add(InputText.parseDouble(fileName, lineNumber, summary.group("ozone"), "ozone"));
                continue;
            }
            Matcher instrument = INSTRUMENT.matcher(line);
            if (instrument.lookingAt()) {
                brewerModel = instrument.group("brewerModel").toLowerCase(Locale.ROOT);
            }
        }

        if (brewerModel == null) {
            throw new MalformedInputException(fileName, 0, "no instrument constants line, brewer model unknown");
        }
        log.debug("parsed {} ozone values from {} ({} skipped, model {})", values.size(), fileName, skipped, brewerModel);
        return new OzoneRecord(toArray(times), toArray(values), brewerModel);
    }

    private static double[] toArray(List<Double> in) {
        double[] out = new double[in.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = in.get(i);
        }
        return out;
    }
}
