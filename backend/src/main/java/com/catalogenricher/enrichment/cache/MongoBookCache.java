package com.catalogenricher.enrichment.cache;

import com.catalogenricher.domain.CacheUpdateMode;
import com.catalogenricher.domain.CachedBook;
import com.catalogenricher.domain.CachedBookRepository;
import com.catalogenricher.domain.CachedBookUpsert;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * {@link BookCache} over the MongoDB books collection.
 */
@Component
@RequiredArgsConstructor
public class MongoBookCache implements BookCache {

    private final CachedBookRepository repository;

    @Override
    public Optional<CacheEntry> getByKey(String barcode) {
        if (barcode == null || barcode.isBlank()) {
            return Optional.empty();
        }
        return repository.findById(barcode).map(MongoBookCache::toEntry);
    }

    @Override
    public int batchUpsert(List<CachedBookUpsert> records, CacheUpdateMode mode) {
        return repository.bulkUpsert(records, mode);
    }

    private static CacheEntry toEntry(CachedBook book) {
        return new CacheEntry(book.getBarcode(), book.getFields(), book.getUpdatedAt());
    }
}
