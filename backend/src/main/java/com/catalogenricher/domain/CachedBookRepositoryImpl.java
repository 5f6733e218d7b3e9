package com.catalogenricher.domain;

import com.mongodb.bulk.BulkWriteResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Implementation of CachedBookRepositoryCustom using MongoTemplate bulk upserts.
 */
@Repository
@RequiredArgsConstructor
public class CachedBookRepositoryImpl implements CachedBookRepositoryCustom {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    @Override
    public int bulkUpsert(List<CachedBookUpsert> upserts, CacheUpdateMode mode) {
        if (upserts == null || upserts.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, CachedBook.class);
        int queued = 0;
        for (CachedBookUpsert upsert : upserts) {
            if (upsert.barcode() == null || upsert.barcode().isBlank()) {
                continue;
            }
            Query query = Query.query(Criteria.where("_id").is(upsert.barcode()));
            Update update = new Update()
                    .set("updatedAt", now)
                    .setOnInsert("createdAt", now)
                    .inc("dataVersion", 1);
            if (upsert.identifier() != null && !upsert.identifier().isBlank()) {
                update.set("identifier", upsert.identifier());
            }
            Map<String, String> fields = nonBlank(upsert.fields());
            if (mode == CacheUpdateMode.OVERWRITE) {
                update.set("fields", fields);
            } else {
                fields.forEach((key, value) -> update.set("fields." + key, value));
            }
            ops.upsert(query, update);
            queued++;
        }
        if (queued == 0) {
            return 0;
        }
        BulkWriteResult result = ops.execute();
        return result.getMatchedCount() + result.getUpserts().size();
    }

    private static Map<String, String> nonBlank(Map<String, String> fields) {
        Map<String, String> out = new LinkedHashMap<>();
        fields.forEach((k, v) -> {
            if (k != null && !k.isBlank() && v != null && !v.isBlank()) {
                out.put(k, v);
            }
        });
        return out;
    }
}
