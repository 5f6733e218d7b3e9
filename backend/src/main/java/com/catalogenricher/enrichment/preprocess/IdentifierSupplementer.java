package com.catalogenricher.enrichment.preprocess;

import com.catalogenricher.domain.CatalogRecord;
import com.catalogenricher.domain.RecordStatus;
import com.catalogenricher.domain.WorkingTable;
import com.catalogenricher.enrichment.config.SupplementProperties;
import com.catalogenricher.enrichment.progress.ProgressTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fills missing identifiers from barcodes via {@link IdentifierResolver}. Runs only when enough rows are
 * eligible (PENDING, no identifier, barcode present) to justify starting a resolver session. Rows the resolver
 * cannot help end as NO_ID.
 */
@Component
@Slf4j
public class IdentifierSupplementer {

    private final SupplementProperties properties;
    private final ObjectProvider<IdentifierResolver> resolverProvider;

    public IdentifierSupplementer(SupplementProperties properties, ObjectProvider<IdentifierResolver> resolverProvider) {
        this.properties = properties;
        this.resolverProvider = resolverProvider;
    }

    public SupplementStats supplement(WorkingTable table, ProgressTracker tracker) {
        String identifierColumn = table.getLayout().identifierColumn();
        List<CatalogRecord> eligible = new ArrayList<>();
        for (CatalogRecord record : table.records()) {
            if (record.getStatus() == RecordStatus.PENDING && !record.hasNormalizedIdentifier()
                    && IdentifierNormalizer.isBlank(record.getValue(identifierColumn)) && record.hasBarcode()) {
                eligible.add(record);
            }
        }
        if (eligible.isEmpty()) {
            return SupplementStats.skipped(0, "no eligible rows");
        }
        if (!properties.isEnabled()) {
            return SupplementStats.skipped(eligible.size(), "disabled");
        }
        IdentifierResolver resolver = resolverProvider.getIfAvailable();
        if (resolver == null) {
            log.info("Identifier supplement: {} eligible rows but no resolver configured", eligible.size());
            return SupplementStats.skipped(eligible.size(), "no resolver configured");
        }
        if (eligible.size() < properties.getMinThreshold()) {
            log.info("Identifier supplement skipped: {} eligible rows below threshold {}",
                    eligible.size(), properties.getMinThreshold());
            return SupplementStats.skipped(eligible.size(), "below threshold " + properties.getMinThreshold());
        }

        int attempted = 0;
        int resolved = 0;
        int failed = 0;
        try {
            resolver.open();
            for (CatalogRecord record : eligible) {
                attempted++;
                Optional<String> identifier = resolveQuietly(resolver, record.getBarcode());
                if (identifier.isPresent()) {
                    tracker.updateRow(record, r -> r.setValue(identifierColumn, identifier.get()));
                    resolved++;
                } else {
                    tracker.markNoId(record, "identifier not resolvable from barcode");
                    failed++;
                }
            }
        } catch (RuntimeException e) {
            log.warn("Identifier resolver session failed after {} rows: {}", attempted, e.getMessage());
        } finally {
            closeQuietly(resolver);
        }
        log.info("Identifier supplement: {} eligible, {} resolved, {} failed", eligible.size(), resolved, failed);
        return new SupplementStats(eligible.size(), attempted, resolved, failed, null);
    }

    private static Optional<String> resolveQuietly(IdentifierResolver resolver, String barcode) {
        try {
            return resolver.resolve(barcode).filter(id -> !id.isBlank()).map(String::strip);
        } catch (RuntimeException e) {
            log.warn("Identifier resolve failed for barcode {}: {}", barcode, e.getMessage());
            return Optional.empty();
        }
    }

    private static void closeQuietly(IdentifierResolver resolver) {
        try {
            resolver.close();
        } catch (RuntimeException e) {
            log.warn("Identifier resolver close failed: {}", e.getMessage());
        }
    }
}
