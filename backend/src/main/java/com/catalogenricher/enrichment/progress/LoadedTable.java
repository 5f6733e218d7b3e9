package com.catalogenricher.enrichment.progress;

import com.catalogenricher.domain.ClassificationManifest;
import com.catalogenricher.domain.WorkingTable;

/**
 * Result of {@link ProgressTracker#load()}: the table to work on, its manifest, and whether it came from a checkpoint.
 */
public record LoadedTable(WorkingTable table, ClassificationManifest manifest, boolean resumed) {
}
