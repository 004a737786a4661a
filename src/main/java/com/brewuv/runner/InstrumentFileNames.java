package com.brewuv.runner;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File naming conventions of Brewer archives.
 */
public final class InstrumentFileNames {
    public static final Pattern UV = Pattern.compile("UV(?<day>\\d{3})(?<year>\\d{2})\\.(?<brewerId>\\d+)");
    public static final Pattern B = Pattern.compile("B(?<day>\\d{3})(?<year>\\d{2})\\.(?<brewerId>\\d+)");
    public static final Pattern UVR = Pattern.compile("(?:UVR|uvr)\\S+\\.(?<brewerId>\\d+)");
    public static final Pattern ARF = Pattern.compile("arf_[a-zA-Z]*(?<brewerId>\\d+)\\.dat");
    public static final Pattern PARAMETER = Pattern.compile("par_(?<year>\\d{2})\\.(?<brewerId>\\d+)");

    private InstrumentFileNames() {
    }

    /**
     * Date encoded in a UV or B file name, or null when the name does not follow the convention.
     */
    public static LocalDate dateOf(Matcher matcher) {
        try {
            int year = 2000 + Integer.parseInt(matcher.group("year"));
            return LocalDate.ofYearDay(year, Integer.parseInt(matcher.group("day")));
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }
    }
}
