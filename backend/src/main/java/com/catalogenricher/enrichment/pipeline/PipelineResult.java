package com.catalogenricher.enrichment.pipeline;

import com.catalogenricher.enrichment.report.RunReport;

import java.nio.file.Path;

/**
 * How a run ended. On STOPPED and FAILED_OUTPUT the checkpoint is kept and {@code outputPath} is null.
 */
public record PipelineResult(Outcome outcome, Path outputPath, Path reportPath, Path checkpointPath,
                             RunReport report, String error) {

    public enum Outcome {
        COMPLETED,
        STOPPED,
        FAILED_OUTPUT
    }

    public boolean isCompleted() {
        return outcome == Outcome.COMPLETED;
    }
}
