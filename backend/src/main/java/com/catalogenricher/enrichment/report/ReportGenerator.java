package com.catalogenricher.enrichment.report;

import com.catalogenricher.domain.CacheCategory;
import com.catalogenricher.domain.CatalogRecord;
import com.catalogenricher.domain.ClassificationManifest;
import com.catalogenricher.domain.RecordStatus;
import com.catalogenricher.domain.WorkingTable;
import com.catalogenricher.enrichment.filter.CategoryStats;
import com.catalogenricher.enrichment.filter.DynamicFilterResult;
import com.catalogenricher.enrichment.table.TableStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link RunReport} as markdown.
 */
@Component
@Slf4j
public class ReportGenerator {

    public static Map<RecordStatus, Integer> statusCounts(WorkingTable table) {
        Map<RecordStatus, Integer> counts = new EnumMap<>(RecordStatus.class);
        for (RecordStatus s : RecordStatus.values()) {
            counts.put(s, 0);
        }
        for (CatalogRecord r : table.records()) {
            counts.merge(r.getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    public static Map<CacheCategory, Integer> categoryCounts(ClassificationManifest manifest) {
        return manifest.counts();
    }

    /**
     * Rows in NOT_FOUND, INVALID_ID or NO_ID, in row order.
     */
    public static List<RunReport.FailedRow> failedRows(WorkingTable table) {
        List<RunReport.FailedRow> failed = new ArrayList<>();
        String identifierColumn = table.getLayout().identifierColumn();
        for (CatalogRecord r : table.records()) {
            RecordStatus s = r.getStatus();
            if (s == RecordStatus.NOT_FOUND || s == RecordStatus.INVALID_ID || s == RecordStatus.NO_ID) {
                failed.add(new RunReport.FailedRow(r.getRowId(), r.getBarcode(), r.getValue(identifierColumn), s,
                        r.getFailureReason() == null ? "" : r.getFailureReason()));
            }
        }
        return failed;
    }

    public String render(RunReport report) {
        StringBuilder md = new StringBuilder();
        md.append("# Enrichment report\n\n");
        md.append("- Input: `").append(report.input()).append("`\n");
        if (report.output() != null) {
            md.append("- Output: `").append(report.output()).append("`\n");
        }
        md.append("- Generated: ").append(report.generatedAt()).append('\n');
        md.append("- Resumed from checkpoint: ").append(report.resumed() ? "yes" : "no").append("\n\n");

        md.append("## Overview\n\n");
        md.append("Total rows: ").append(report.totalRows()).append("\n\n");
        md.append("| Status | Rows |\n|---|---:|\n");
        report.statusCounts().forEach((s, n) -> md.append("| ").append(s.name()).append(" | ").append(n).append(" |\n"));
        md.append('\n');
        md.append("| Category | Rows |\n|---|---:|\n");
        report.categoryCounts().forEach((c, n) -> md.append("| ").append(c.getKey()).append(" | ").append(n).append(" |\n"));
        md.append('\n');

        if (report.preprocess() != null) {
            var p = report.preprocess();
            md.append("## Identifier preprocessing\n\n");
            md.append("- Normalized: ").append(p.normalized()).append(" (").append(p.alreadyNormalized()).append(" already normalized)\n");
            md.append("- Invalid identifier: ").append(p.invalid()).append('\n');
            md.append("- No identifier and no barcode: ").append(p.noIdentifier()).append('\n');
            md.append("- Missing identifier with barcode: ").append(p.missingWithBarcode()).append("\n\n");
        }
        if (report.supplement() != null) {
            var s = report.supplement();
            md.append("## Identifier supplement\n\n");
            md.append("- Eligible: ").append(s.eligible()).append('\n');
            if (s.ran()) {
                md.append("- Resolved: ").append(s.resolved()).append('\n');
                md.append("- Failed: ").append(s.failed()).append("\n\n");
            } else {
                md.append("- Skipped: ").append(s.skipReason()).append("\n\n");
            }
        }
        if (report.classification() != null) {
            var c = report.classification();
            md.append("## Cache classification\n\n");
            if (!c.cacheEnabled()) {
                md.append("Cache disabled; every row treated as new.\n\n");
            }
            md.append("- Examined: ").append(c.examined()).append(" (").append(c.skippedTerminal()).append(" terminal rows skipped)\n");
            md.append("- Cache read errors: ").append(c.cacheErrors()).append("\n\n");
        }
        if (report.fetch() != null) {
            var f = report.fetch();
            md.append("## Metadata fetch\n\n");
            md.append("- Eligible: ").append(f.eligible()).append('\n');
            md.append("- Attempted: ").append(f.attempted()).append('\n');
            md.append("- Found: ").append(f.succeeded()).append('\n');
            md.append("- Not found: ").append(f.notFound()).append('\n');
            md.append("- Success rate: ").append(percent(f.successRate())).append('\n');
            md.append("- Left pending: ").append(f.cancelled()).append(f.stopped() ? " (stopped)" : "").append('\n');
            md.append("- Requests: ").append(f.requests()).append(", cooldowns: ").append(f.cooldowns())
                    .append(", lookup cache hits: ").append(f.lookupCacheHits()).append("\n\n");
        }
        if (report.cacheWrite() != null) {
            var w = report.cacheWrite();
            md.append("## Cache write-back\n\n");
            if (w.skipped()) {
                md.append("Skipped (cache disabled); ").append(w.eligible()).append(" rows eligible.\n\n");
            } else {
                md.append("- Eligible: ").append(w.eligible()).append('\n');
                md.append("- Written: ").append(w.written()).append('\n');
                md.append("- Failed batches: ").append(w.failedBatches()).append("\n\n");
            }
        }
        if (report.filter() != null) {
            renderFilter(md, report.filter());
        }
        renderFailedRows(md, report.failedRows());
        return md.toString();
    }

    public void write(Path path, RunReport report) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, render(report), StandardCharsets.UTF_8);
            log.info("Report written to {}", path);
        } catch (IOException e) {
            throw new TableStoreException("Failed to write report " + path + ": " + e.getMessage(), e);
        }
    }

    private static void renderFilter(StringBuilder md, DynamicFilterResult filter) {
        DynamicFilterResult.Settings settings = filter.settings();
        md.append("## Threshold filter\n\n");
        md.append("- Samples with rating: ").append(filter.totalSamples()).append('\n');
        md.append("- Candidates: ").append(filter.candidateCount()).append('\n');
        if (settings != null) {
            md.append("- Review band: P").append(fmt(settings.reviewLowerPercentile()))
                    .append("–P").append(fmt(settings.reviewUpperPercentile()))
                    .append(", large-sample rating percentile: P").append(fmt(settings.ratingPercentileLarge()))
                    .append(", min sample size: ").append(settings.minSampleSize())
                    .append(", column rules: ").append(settings.activeColumnRules()).append('\n');
        }
        md.append('\n');
        if (filter.stats().isEmpty()) {
            return;
        }
        md.append("| Category | Samples | Type | Review band | Floor | Threshold | Candidates | In group | Overall |\n");
        md.append("|---|---:|---|---|---:|---:|---:|---:|---:|\n");
        for (CategoryStats s : filter.stats()) {
            md.append("| ").append(s.category())
                    .append(" | ").append(s.sampleCount())
                    .append(" | ").append(s.sampleType().name().toLowerCase(Locale.ROOT))
                    .append(" | ").append(s.reviewLower() == null ? "n/a" : "[" + fmt(s.reviewLower()) + ", " + fmt(s.reviewUpper()) + "]")
                    .append(" | ").append(fmt(s.floor()))
                    .append(" | ").append(s.threshold() == null ? "n/a" : fmt(s.threshold()))
                    .append(" | ").append(s.candidateCount() == null ? "n/a" : s.candidateCount().toString())
                    .append(" | ").append(percent(s.ratioInGroup()))
                    .append(" | ").append(percent(s.ratioOverall()))
                    .append(" |\n");
        }
        md.append('\n');
    }

    private static void renderFailedRows(StringBuilder md, List<RunReport.FailedRow> failedRows) {
        md.append("## Failed rows\n\n");
        if (failedRows == null || failedRows.isEmpty()) {
            md.append("None.\n");
            return;
        }
        md.append("| Row | Barcode | Identifier | Status | Reason |\n|---:|---|---|---|---|\n");
        for (RunReport.FailedRow row : failedRows) {
            md.append("| ").append(row.rowId())
                    .append(" | ").append(escape(row.barcode()))
                    .append(" | ").append(escape(row.identifier()))
                    .append(" | ").append(row.status().name())
                    .append(" | ").append(escape(row.reason()))
                    .append(" |\n");
        }
    }

    static String fmt(double value) {
        if (Double.isNaN(value)) {
            return "n/a";
        }
        if (value == Math.rint(value)) {
            return String.format(Locale.ROOT, "%.0f", value);
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }

    static String percent(double ratio) {
        return Double.isNaN(ratio) ? "n/a" : String.format(Locale.ROOT, "%.1f%%", ratio * 100);
    }

    private static String escape(String s) {
        return s == null ? "" : s.replace("|", "\\|").replace('\n', ' ');
    }
}
