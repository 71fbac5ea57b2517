package com.eyelevel.paperprocessor.model;

import java.util.Map;

/**
 * A point-in-time view of the pipeline's configured limits, free concurrency slots and counters.
 */
public record PipelineStatus(Limits limits, Slots availableSlots, Map<String, Double> counters) {

    public record Limits(int maxDownloads, int maxExtractions, int maxCompilations, double requestsPerSecond,
                         int maxFilesPerArchive) {
    }

    public record Slots(int download, int extraction, int compilation) {
    }
}
