package com.pulse.trending.model;

/**
 * Mention counts inside the short, medium and long windows.
 */
public record MentionDistribution(int shortWindow, int mediumWindow, int longWindow) {

    public static final MentionDistribution EMPTY = new MentionDistribution(0, 0, 0);
}
