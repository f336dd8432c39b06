package com.caltrack.backend.scaling;

/**
 * How natural/added sugar is derived when a product records only total sugar.
 */
public enum SugarSplitPolicy {

    /** Keep natural/added sugar exactly as recorded (absent stays absent). */
    NONE,

    /**
     * When sugar is present and neither natural nor added sugar is recorded,
     * count all of it as added sugar and natural sugar as 0.
     */
    UNSPECIFIED_IS_ADDED;

    public NutritionSnapshot apply(NutritionSnapshot s) {
        if (this == NONE || s == null) return s;
        if (s.sugar() == null) return s;
        if (s.naturalSugar() != null || s.addedSugar() != null) return s;
        return s.withSugarSplit(0.0, s.sugar());
    }
}
