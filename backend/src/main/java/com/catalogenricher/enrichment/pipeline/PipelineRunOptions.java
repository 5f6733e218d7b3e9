package com.catalogenricher.enrichment.pipeline;

import com.catalogenricher.enrichment.fetch.StopSignal;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One pipeline invocation. {@code output} may be null, in which case a timestamped file is written to the configured
 * output directory.
 */
public record PipelineRunOptions(Path input, Path output, boolean forceUpdate, StopSignal stopSignal) {

    public PipelineRunOptions {
        Objects.requireNonNull(input, "input");
        stopSignal = stopSignal == null ? new StopSignal() : stopSignal;
    }

    public static PipelineRunOptions of(Path input) {
        return new PipelineRunOptions(input, null, false, new StopSignal());
    }
}
