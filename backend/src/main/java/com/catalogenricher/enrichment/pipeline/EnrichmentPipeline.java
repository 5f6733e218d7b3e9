package com.catalogenricher.enrichment.pipeline;

import com.catalogenricher.domain.ClassificationManifest;
import com.catalogenricher.domain.TableLayout;
import com.catalogenricher.domain.WorkingTable;
import com.catalogenricher.enrichment.cache.CacheFieldMapper;
import com.catalogenricher.enrichment.classifier.CacheClassifier;
import com.catalogenricher.enrichment.classifier.ClassificationStats;
import com.catalogenricher.enrichment.config.EnrichmentSettingsValidator;
import com.catalogenricher.enrichment.config.OutputProperties;
import com.catalogenricher.enrichment.config.TableColumnProperties;
import com.catalogenricher.enrichment.config.ThresholdFilterProperties;
import com.catalogenricher.enrichment.fetch.FetchStats;
import com.catalogenricher.enrichment.fetch.MetadataFetcher;
import com.catalogenricher.enrichment.filter.DynamicFilterResult;
import com.catalogenricher.enrichment.filter.FilterColumns;
import com.catalogenricher.enrichment.filter.ThresholdFilter;
import com.catalogenricher.enrichment.preprocess.IdentifierPreprocessor;
import com.catalogenricher.enrichment.preprocess.IdentifierSupplementer;
import com.catalogenricher.enrichment.preprocess.PreprocessStats;
import com.catalogenricher.enrichment.preprocess.SupplementStats;
import com.catalogenricher.enrichment.progress.LoadedTable;
import com.catalogenricher.enrichment.progress.ProgressTracker;
import com.catalogenricher.enrichment.progress.ProgressTrackerFactory;
import com.catalogenricher.enrichment.report.ReportGenerator;
import com.catalogenricher.enrichment.report.RunReport;
import com.catalogenricher.enrichment.store.CacheWriteResult;
import com.catalogenricher.enrichment.store.CacheWriter;
import com.catalogenricher.enrichment.table.TableStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Runs one table through preprocess, supplement, cache classification, fetch, cache write-back and the threshold
 * filter, checkpointing between steps. A run that is stopped or cannot write its output leaves the checkpoint in
 * place; running again with the same input resumes from it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EnrichmentPipeline {

    private static final DateTimeFormatter OUTPUT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final EnrichmentSettingsValidator settingsValidator;
    private final TableColumnProperties columnProperties;
    private final ThresholdFilterProperties filterProperties;
    private final OutputProperties outputProperties;
    private final ProgressTrackerFactory trackerFactory;
    private final IdentifierPreprocessor preprocessor;
    private final IdentifierSupplementer supplementer;
    private final CacheClassifier classifier;
    private final MetadataFetcher fetcher;
    private final CacheWriter cacheWriter;
    private final ThresholdFilter thresholdFilter;
    private final CacheFieldMapper fieldMapper;
    private final ReportGenerator reportGenerator;
    private final Clock clock;

    public PipelineResult run(PipelineRunOptions options) {
        settingsValidator.validate();

        TableLayout layout = layout();
        ProgressTracker tracker = trackerFactory.forInput(options.input(), layout);
        LoadedTable loaded = tracker.load();
        WorkingTable table = loaded.table();
        ClassificationManifest manifest = loaded.manifest();
        log.info("Pipeline start: {} ({} rows{})", options.input(), table.size(), loaded.resumed() ? ", resumed" : "");

        fieldMapper.mappedColumns().forEach(table::ensureColumn);
        if (filterProperties.isEnabled()) {
            table.ensureColumn(columnProperties.getCandidate());
        }

        PreprocessStats preprocessStats = preprocessor.preprocess(table, tracker);
        SupplementStats supplementStats = supplementer.supplement(table, tracker);
        if (supplementStats.resolved() > 0) {
            preprocessor.preprocess(table, tracker);
        }
        tracker.checkpoint(table, manifest, false, "preprocess");

        ClassificationStats classificationStats = classifier.classify(table, manifest, tracker, options.forceUpdate());
        tracker.checkpoint(table, manifest, true, "classification");

        FetchStats fetchStats = fetcher.fetch(table, manifest, tracker, options.stopSignal());
        CacheWriteResult cacheWrite = cacheWriter.write(table, manifest);

        if (fetchStats.stopped() || options.stopSignal().isStopRequested()) {
            tracker.checkpoint(table, manifest, true, "stopped");
            log.warn("Pipeline stopped; progress kept in {}. Run again with the same input to resume.",
                    tracker.getCheckpointPath());
            RunReport report = report(options, null, loaded, table, manifest, preprocessStats, supplementStats,
                    classificationStats, fetchStats, cacheWrite, null);
            return new PipelineResult(PipelineResult.Outcome.STOPPED, null, null, tracker.getCheckpointPath(),
                    report, null);
        }

        DynamicFilterResult filterResult = null;
        if (filterProperties.isEnabled()) {
            FilterColumns filterColumns = new FilterColumns(columnProperties.columnFor("rating"),
                    columnProperties.columnFor("rating_count"), columnProperties.getCallNumber());
            filterResult = thresholdFilter.analyze(table, filterColumns);
            thresholdFilter.applyCandidateMarkers(table, filterResult, columnProperties.getCandidate());
        }

        Path outputPath = options.output() != null ? options.output() : defaultOutputPath(options.input());
        try {
            tracker.finalizeRun(table, outputPath);
        } catch (TableStoreException e) {
            log.error("Could not write output {}: {}", outputPath, e.getMessage());
            tracker.checkpoint(table, manifest, true, "output failed");
            RunReport report = report(options, null, loaded, table, manifest, preprocessStats, supplementStats,
                    classificationStats, fetchStats, cacheWrite, filterResult);
            return new PipelineResult(PipelineResult.Outcome.FAILED_OUTPUT, null, null, tracker.getCheckpointPath(),
                    report, e.getMessage());
        }

        RunReport report = report(options, outputPath, loaded, table, manifest, preprocessStats, supplementStats,
                classificationStats, fetchStats, cacheWrite, filterResult);
        Path reportPath = null;
        if (outputProperties.isGenerateReport()) {
            reportPath = reportPathFor(outputPath);
            try {
                reportGenerator.write(reportPath, report);
            } catch (TableStoreException e) {
                log.warn("Output written but report failed: {}", e.getMessage());
                reportPath = null;
            }
        }
        log.info("Pipeline complete: {} rows written to {}", table.size(), outputPath);
        return new PipelineResult(PipelineResult.Outcome.COMPLETED, outputPath, reportPath, tracker.getCheckpointPath(),
                report, null);
    }

    TableLayout layout() {
        return new TableLayout(columnProperties.getBarcode(), columnProperties.getIdentifier(),
                columnProperties.getStatus(), columnProperties.getSource());
    }

    Path defaultOutputPath(Path input) {
        String stem = ProgressTrackerFactory.stemOf(input);
        String timestamp = LocalDateTime.now(clock).format(OUTPUT_TIMESTAMP);
        return Path.of(outputProperties.getDirectory()).resolve(stem + "_enriched_" + timestamp + ".csv");
    }

    static Path reportPathFor(Path outputPath) {
        String name = outputPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return outputPath.resolveSibling(stem + "_report.md");
    }

    private RunReport report(PipelineRunOptions options, Path outputPath, LoadedTable loaded, WorkingTable table,
                             ClassificationManifest manifest, PreprocessStats preprocess, SupplementStats supplement,
                             ClassificationStats classification, FetchStats fetch, CacheWriteResult cacheWrite,
                             DynamicFilterResult filter) {
        return new RunReport(options.input().toString(), outputPath == null ? null : outputPath.toString(),
                clock.instant(), loaded.resumed(), table.size(), ReportGenerator.statusCounts(table),
                ReportGenerator.categoryCounts(manifest), preprocess, supplement, classification, fetch, cacheWrite,
                filter, ReportGenerator.failedRows(table));
    }
}
