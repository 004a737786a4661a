package com.brewuv.parse;

import com.brewuv.model.MeasurementSection;
import com.brewuv.model.Position;
import com.brewuv.model.RawSample;
import com.brewuv.model.SectionHeader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads raw UV files ({@code UVdddyy.bid}).
 * <p>
 * A file is a sequence of sections. Each section is a header line followed by value lines
 * ({@code time wavelength(Å) step events}) and ends with {@code end}, with a {@code dark <value>} line
 * introducing a reverse scan, or with the end of the file. A blank line or the {@code 0x1A} marker ends the file.
 */
public final class UvFileParser {
    private static final Logger log = LogManager.getLogger(UvFileParser.class);

    private static final Pattern HEADER = Pattern.compile(
            "^(?<type>[a-z]{2})\\s+"
                    + "Integration time is (?<integrationTime>\\S+) seconds.+"
                    + "dt\\s+(?<deadTime>\\S+).+"
                    + "cy\\s+(?<cycles>\\d+).+"
                    + "dh\\s+(?<day>\\d+) (?<month>\\d+) (?<year>\\d+)\\s+"
                    + "(?<place>(?: ?[a-zA-Z])+)\\s+"
                    + "(?<latitude>\\S+) +(?<longitude>\\S+) +(?<temperature>\\S+)\\s+"
                    + "pr\\s*(?<pressure>\\d+).*"
                    + "dark\\s*(?<dark>\\S+)\\s*$"
    );
    private static final Pattern VALUE = Pattern.compile("^\\s*(\\S+)\\s+(\\S+)\\s+(\\d+)\\s+(\\S+)\\s*$");
    private static final Pattern DARK = Pattern.compile("^\\s*dark\\s+(\\S+)\\s*$");
    private static final String END_OF_FILE_MARKER = "\u001A";

    static final double TEMPERATURE_OFFSET = -33.27;
    static final double TEMPERATURE_SLOPE = 18.64;

    public List<MeasurementSection> parse(Path path) throws IOException {
        return parse(path.getFileName().toString(), InputText.read(path));
    }

    public List<MeasurementSection> parse(String fileName, String content) {
        List<String> lines = InputText.lines(content);
        List<MeasurementSection> sections = new ArrayList<>();
        int index = 0;

        while (index < lines.size()) {
            String headerLine = lines.get(index);
            String marker = headerLine.trim();
            if (marker.isEmpty() || END_OF_FILE_MARKER.equals(marker)) {
                break;
            }
            SectionHeader header = parseHeader(fileName, index + 1, headerLine);
            index++;

            List<double[]> values = new ArrayList<>();
            while (index < lines.size() && isValueLine(lines.get(index))) {
                values.add(parseValue(fileName, index + 1, lines.get(index)));
                index++;
            }

            if (index < lines.size() && !lines.get(index).trim().isEmpty()) {
                Matcher dark = DARK.matcher(lines.get(index));
                if (dark.matches()) {
                    double secondDark = InputText.parseDouble(fileName, index + 1, dark.group(1), "dark count");
                    header = header.toBuilder().darkCount((header.darkCount + secondDark) / 2.0).build();
                    index++;
                    index = mergeReverseScan(fileName, lines, index, values);
                    if (index < lines.size() && !lines.get(index).contains("end")) {
                        throw new MalformedInputException(fileName, index + 1,
                                "expected 'end' after reverse scan but found '" + lines.get(index).trim() + "'");
                    }
                }
                // skip the terminating line ('end' or an unmatched dark line)
                index++;
            }

            sections.add(new MeasurementSection(header, toSamples(values)));
        }

        if (sections.isEmpty()) {
            throw new MalformedInputException(fileName, 0, "no measurement section found");
        }
        log.debug("parsed {} sections from {}", sections.size(), fileName);
        return sections;
    }

    private static boolean isValueLine(String line) {
        return !line.contains("dark") && !line.contains("end") && !line.trim().isEmpty();
    }

    /**
     * The reverse scan repeats the wavelengths from last to first; times and events are averaged into the forward values.
     */
    private int mergeReverseScan(String fileName, List<String> lines, int index, List<double[]> values) {
        for (int i = values.size() - 1; i >= 0; i--) {
            if (index >= lines.size()) {
                throw new MalformedInputException(fileName, index, "reverse scan ended early, "
                        + (i + 1) + " values missing");
            }
            double[] forward = values.get(i);
            double[] backward = parseValue(fileName, index + 1, lines.get(index));
            forward[0] = (forward[0] + backward[0]) / 2.0;
            forward[3] = (forward[3] + backward[3]) / 2.0;
            index++;
        }
        return index;
    }

    private static List<RawSample> toSamples(List<double[]> values) {
        List<RawSample> samples = new ArrayList<>(values.size());
        for (double[] v : values) {
            samples.add(new RawSample(v[0], v[1], (int) v[2], v[3]));
        }
        return samples;
    }

    SectionHeader parseHeader(String fileName, int lineNumber, String line) {
        Matcher m = HEADER.matcher(line);
        if (!m.matches()) {
            throw new MalformedInputException(fileName, lineNumber, "unable to parse section header '" + line.trim() + "'");
        }
        double integrationTime = InputText.parseDouble(fileName, lineNumber, m.group("integrationTime"), "integration time");
        if (integrationTime == 0.1147) {
            log.warn("{}:{} integration time is 0.1147, the expected value is usually 0.2294", fileName, lineNumber);
        }
        LocalDate date;
        try {
            date = LocalDate.of(
                    2000 + Integer.parseInt(m.group("year")),
                    Integer.parseInt(m.group("month")),
                    Integer.parseInt(m.group("day"))
            );
        } catch (DateTimeException | NumberFormatException e) {
            throw new MalformedInputException(fileName, lineNumber, "invalid date in section header", e);
        }
        double temperatureIndex = InputText.parseDouble(fileName, lineNumber, m.group("temperature"), "temperature");
        return SectionHeader.builder()
                .scanType(m.group("type"))
                .integrationTime(integrationTime)
                .deadTime(InputText.parseDouble(fileName, lineNumber, m.group("deadTime"), "dead time"))
                .cycles(InputText.parseInt(fileName, lineNumber, m.group("cycles"), "cycles"))
                .date(date)
                .place(m.group("place").trim())
                .position(new Position(
                        InputText.parseDouble(fileName, lineNumber, m.group("latitude"), "latitude"),
                        InputText.parseDouble(fileName, lineNumber, m.group("longitude"), "longitude")))
                .temperature(TEMPERATURE_OFFSET + temperatureIndex * TEMPERATURE_SLOPE)
                .pressure(InputText.parseDouble(fileName, lineNumber, m.group("pressure"), "pressure"))
                .darkCount(InputText.parseDouble(fileName, lineNumber, m.group("dark"), "dark count"))
                .build();
    }

    private static double[] parseValue(String fileName, int lineNumber, String line) {
        Matcher m = VALUE.matcher(line);
        if (!m.matches()) {
            throw new MalformedInputException(fileName, lineNumber, "unable to parse value line '" + line.trim() + "'");
        }
        return new double[]{
                InputText.parseDouble(fileName, lineNumber, m.group(1), "time"),
                InputText.parseDouble(fileName, lineNumber, m.group(2), "wavelength") / 10.0,
                InputText.parseInt(fileName, lineNumber, m.group(3), "step"),
                InputText.parseDouble(fileName, lineNumber, m.group(4), "events")
        };
    }
}
