package com.catalogenricher.enrichment.preprocess;

import com.catalogenricher.domain.CatalogRecord;
import com.catalogenricher.domain.RecordStatus;
import com.catalogenricher.domain.WorkingTable;
import com.catalogenricher.enrichment.progress.ProgressTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Derives the normalized identifier of every row and records rows that can never be looked up.
 * Safe to run repeatedly: rows that already carry a normalized identifier are left alone.
 */
@Component
@Slf4j
public class IdentifierPreprocessor {

    public PreprocessStats preprocess(WorkingTable table, ProgressTracker tracker) {
        String identifierColumn = table.getLayout().identifierColumn();
        int normalized = 0;
        int alreadyNormalized = 0;
        int invalid = 0;
        int noIdentifier = 0;
        int missingWithBarcode = 0;
        for (CatalogRecord record : table.records()) {
            if (record.hasNormalizedIdentifier()) {
                alreadyNormalized++;
                continue;
            }
            String raw = record.getValue(identifierColumn);
            Optional<String> identifier = IdentifierNormalizer.normalize(raw);
            if (identifier.isPresent()) {
                tracker.updateRow(record, r -> r.assignNormalizedIdentifier(identifier.get()));
                normalized++;
            } else if (!IdentifierNormalizer.isBlank(raw)) {
                if (record.getStatus() == RecordStatus.PENDING) {
                    tracker.markInvalidId(record, "invalid identifier '" + raw.strip() + "'");
                }
                invalid++;
            } else if (!record.hasBarcode()) {
                if (record.getStatus() == RecordStatus.PENDING) {
                    tracker.markNoId(record, "no identifier and no barcode");
                }
                noIdentifier++;
            } else {
                missingWithBarcode++;
            }
        }
        PreprocessStats stats = new PreprocessStats(table.size(), normalized, alreadyNormalized, invalid,
                noIdentifier, missingWithBarcode);
        log.info("Preprocess: {} rows, {} normalized ({} already), {} invalid, {} without identifier or barcode, {} awaiting supplement",
                stats.total(), normalized, alreadyNormalized, invalid, noIdentifier, missingWithBarcode);
        return stats;
    }
}
