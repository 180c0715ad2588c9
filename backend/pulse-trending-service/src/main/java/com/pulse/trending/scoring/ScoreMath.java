package com.pulse.trending.scoring;

final class ScoreMath {

    private ScoreMath() {}

    /** Clamps to [0,1]; NaN becomes 0. */
    static double clamp01(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
