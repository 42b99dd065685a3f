package com.williamcallahan.pdfrag.service.retrieval;

import com.williamcallahan.pdfrag.domain.retrieval.TimingStats;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the most recent durations of each retrieval stage in bounded ring buffers.
 *
 * <p>Thread-safe; each recorded sample evicts the oldest once a stage holds {@code maxSamples}.</p>
 */
public class PerformanceMetrics {
    private static final Logger log = LoggerFactory.getLogger(PerformanceMetrics.class);

    public static final String VECTOR_RETRIEVAL = "vector_retrieval";
    public static final String SEMANTIC_RERANKING = "semantic_reranking";
    public static final String MMR_APPLICATION = "mmr_application";
    public static final String CACHE_OPERATIONS = "cache_operations";
    public static final String TOTAL_TIME = "total_time";

    static final int DEFAULT_MAX_SAMPLES = 1000;

    private final int maxSamples;
    private final Map<String, Deque<Double>> samples = new LinkedHashMap<>();

    public PerformanceMetrics() {
        this(DEFAULT_MAX_SAMPLES);
    }

    public PerformanceMetrics(int maxSamples) {
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be positive");
        }
        this.maxSamples = maxSamples;
        for (String stage : new String[] {
                VECTOR_RETRIEVAL, SEMANTIC_RERANKING, MMR_APPLICATION, CACHE_OPERATIONS, TOTAL_TIME}) {
            samples.put(stage, new ArrayDeque<>());
        }
    }

    /**
     * Records one duration; unknown stages are ignored.
     */
    public synchronized void record(String stage, Duration elapsed) {
        Deque<Double> buffer = samples.get(stage);
        if (buffer == null) {
            return;
        }
        if (buffer.size() == maxSamples) {
            buffer.removeFirst();
        }
        buffer.addLast(elapsed.toNanos() / 1_000_000_000.0);
    }

    public synchronized int sampleCount(String stage) {
        Deque<Double> buffer = samples.get(stage);
        return buffer == null ? 0 : buffer.size();
    }

    /**
     * Statistics for every stage with at least one sample, in stage order.
     */
    public synchronized Map<String, TimingStats> statistics() {
        Map<String, TimingStats> stats = new LinkedHashMap<>();
        for (Map.Entry<String, Deque<Double>> entry : samples.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                stats.put(entry.getKey(), summarize(entry.getValue()));
            }
        }
        return stats;
    }

    public void logStatistics() {
        Map<String, TimingStats> stats = statistics();
        log.info("[RAG] Performance over the last {} samples:", maxSamples);
        stats.forEach((stage, timing) -> log.info("[RAG]   {}: min={}s max={}s avg={}s median={}s count={}",
                stage, format(timing.min()), format(timing.max()), format(timing.avg()),
                format(timing.median()), timing.count()));
    }

    public synchronized void reset() {
        samples.values().forEach(Deque::clear);
    }

    private static TimingStats summarize(Deque<Double> buffer) {
        double[] values = buffer.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(values);
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        int n = values.length;
        double median = n % 2 == 1 ? values[n / 2] : (values[n / 2 - 1] + values[n / 2]) / 2.0;
        return new TimingStats(values[0], values[n - 1], sum / n, median, n);
    }

    private static String format(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }
}
