package com.brewuv.core.diagnostics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Success-or-unavailable result of a lookup. Expected absences are reported here instead of being thrown.
 */
public final class Outcome<T> {
    public final boolean success;
    public final T value;
    public final CauseCode causeCode;
    public final String owner;
    public final Map<String, Object> details;

    private Outcome(boolean success, T value, CauseCode causeCode, String owner, Map<String, Object> details) {
        this.success = success;
        this.value = value;
        this.causeCode = causeCode == null ? CauseCode.NONE : causeCode;
        this.owner = owner == null ? "" : owner;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static <T> Outcome<T> success(T value, String owner) {
        return new Outcome<>(true, value, CauseCode.NONE, owner, Map.of());
    }

    public static <T> Outcome<T> failure(CauseCode causeCode, String owner) {
        return new Outcome<>(false, null, causeCode, owner, Map.of());
    }

    public static <T> Outcome<T> failure(CauseCode causeCode, String owner, Map<String, Object> details) {
        return new Outcome<>(false, null, causeCode, owner, copy(details));
    }

    public static <T> Outcome<T> failure(CauseCode causeCode, String owner, String message) {
        return new Outcome<>(false, null, causeCode, owner,
                message == null ? Map.of() : Map.of("message", message));
    }

    public String message() {
        Object message = details.get("message");
        return message == null ? "" : message.toString();
    }

    /**
     * Short human-readable form, e.g. {@code eubrewnet:TIMEOUT(read timed out)}.
     */
    public String describe() {
        if (success) {
            return owner + ":OK";
        }
        String message = message();
        return owner + ":" + causeCode + (message.isEmpty() ? "" : "(" + message + ")");
    }

    private static Map<String, Object> copy(Map<String, Object> in) {
        if (in == null || in.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : in.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                out.put(entry.getKey(), entry.getValue());
            }
        }
        return out;
    }
}
