package com.brewuv.model;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Parameter rows keyed by day of year.
 */
public final class ParameterTable {
    private final NavigableMap<Integer, ParameterRow> rows;

    public ParameterTable(Collection<ParameterRow> rows) {
        TreeMap<Integer, ParameterRow> byDay = new TreeMap<>();
        for (ParameterRow row : rows) {
            byDay.put(row.day, row);
        }
        if (byDay.isEmpty()) {
            throw new IllegalArgumentException("parameter table has no rows");
        }
        this.rows = byDay;
    }

    public static ParameterTable single(double albedo, double alpha, double beta) {
        return new ParameterTable(List.of(new ParameterRow(0, albedo, alpha, beta, null)));
    }

    public int size() {
        return rows.size();
    }

    /**
     * Row in effect for {@code day}: the last row at or before it, or the first row for earlier days.
     */
    public ParameterRow rowFor(int day) {
        Map.Entry<Integer, ParameterRow> entry = rows.floorEntry(day);
        return entry == null ? rows.firstEntry().getValue() : entry.getValue();
    }

    /**
     * Cloud cover is never carried between days.
     */
    public Double cloudCover(int day) {
        ParameterRow row = rows.get(day);
        return row == null ? null : row.cloudCover;
    }
}
