package com.williamcallahan.pdfrag.domain.retrieval;

/**
 * Summary of recent durations for one retrieval stage, in seconds.
 */
public record TimingStats(double min, double max, double avg, double median, int count) {

    public static TimingStats empty() {
        return new TimingStats(0.0, 0.0, 0.0, 0.0, 0);
    }
}
