package com.brewuv.model;

import java.util.Locale;

public enum StraylightCorrection {
    APPLIED,
    NOT_APPLIED,
    UNDEFINED;

    /**
     * Single monochromator models (mki, mkii, mkiv) need straylight removal, the double monochromator mkiii does not.
     */
    public static StraylightCorrection forBrewerModel(String model) {
        if (model == null) {
            return UNDEFINED;
        }
        switch (model.trim().toLowerCase(Locale.ROOT)) {
            case "mki":
            case "mkii":
            case "mkiv":
                return APPLIED;
            case "mkiii":
                return NOT_APPLIED;
            default:
                return UNDEFINED;
        }
    }
}
