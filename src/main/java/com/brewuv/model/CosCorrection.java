package com.brewuv.model;

/**
 * Cosine correction model applied to a spectrum.
 */
public enum CosCorrection {
    CLEAR_SKY,
    DIFFUSE,
    NONE
}
