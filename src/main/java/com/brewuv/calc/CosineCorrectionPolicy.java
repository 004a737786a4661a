package com.brewuv.calc;

import com.brewuv.model.CosCorrection;

/**
 * Chooses the cosine correction model from the cloud cover in effect.
 */
public interface CosineCorrectionPolicy {

    /**
     * @param cloudCover cloud fraction between 0 and 1, or null when unknown
     */
    CosCorrection select(Double cloudCover);
}
