package com.catalogenricher.enrichment.cache;

import com.catalogenricher.domain.CacheUpdateMode;
import com.catalogenricher.domain.CachedBook;
import com.catalogenricher.domain.CachedBookRepository;
import com.catalogenricher.domain.CachedBookUpsert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers(disabledWithoutDocker = true)
@Import({MongoBookCache.class, MongoBookCacheIntegrationTest.FixedClockConfig.class})
class MongoBookCacheIntegrationTest {

    static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    MongoBookCache bookCache;

    @Autowired
    CachedBookRepository repository;

    @BeforeEach
    void clean() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("merge keeps fields the new upsert does not carry and bumps the version")
    void mergeUpsert() {
        bookCache.batchUpsert(List.of(new CachedBookUpsert("B1", "9787111111111",
                Map.of("title", "Old title", "summary", "Kept summary"))), CacheUpdateMode.MERGE);
        int written = bookCache.batchUpsert(List.of(new CachedBookUpsert("B1", "9787111111111",
                Map.of("title", "New title", "url", "https://book/1"))), CacheUpdateMode.MERGE);

        assertThat(written).isEqualTo(1);
        CachedBook book = repository.findById("B1").orElseThrow();
        assertThat(book.getFields())
                .containsEntry("title", "New title")
                .containsEntry("summary", "Kept summary")
                .containsEntry("url", "https://book/1");
        assertThat(book.getDataVersion()).isEqualTo(2);
        assertThat(book.getCreatedAt()).isEqualTo(NOW);
        assertThat(book.getUpdatedAt()).isEqualTo(NOW);
        assertThat(repository.findByIdentifier("9787111111111")).hasSize(1);
    }

    @Test
    @DisplayName("overwrite replaces the stored field map and skips blank values")
    void overwriteUpsert() {
        bookCache.batchUpsert(List.of(new CachedBookUpsert("B2", "9787222222222",
                Map.of("title", "Old", "summary", "Dropped"))), CacheUpdateMode.MERGE);
        bookCache.batchUpsert(List.of(new CachedBookUpsert("B2", "9787222222222",
                Map.of("title", "Replaced", "author", " "))), CacheUpdateMode.OVERWRITE);

        CacheEntry entry = bookCache.getByKey("B2").orElseThrow();
        assertThat(entry.fields()).containsOnlyKeys("title").containsEntry("title", "Replaced");
        assertThat(entry.updatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("unknown or blank barcodes read as absent")
    void missingKeys() {
        assertThat(bookCache.getByKey("nope")).isEmpty();
        assertThat(bookCache.getByKey(" ")).isEmpty();
        assertThat(bookCache.batchUpsert(List.of(), CacheUpdateMode.MERGE)).isZero();
    }

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }
}
