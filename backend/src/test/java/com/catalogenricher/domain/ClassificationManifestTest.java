package com.catalogenricher.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ClassificationManifestTest {

    @Test
    @DisplayName("each row belongs to at most one category; reassigning moves it")
    void reassignMovesRow() {
        ClassificationManifest manifest = new ClassificationManifest();
        manifest.assign(1, CacheCategory.NEW);
        manifest.assign(1, CacheCategory.EXISTING_VALID);

        assertThat(manifest.rowsIn(CacheCategory.NEW)).isEmpty();
        assertThat(manifest.rowsIn(CacheCategory.EXISTING_VALID)).containsExactly(1);
        assertThat(manifest.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("only new, stale and incomplete rows are fetch-eligible")
    void fetchEligibility() {
        ClassificationManifest manifest = new ClassificationManifest();
        manifest.assign(0, CacheCategory.EXISTING_VALID);
        manifest.assign(1, CacheCategory.EXISTING_VALID_INCOMPLETE);
        manifest.assign(2, CacheCategory.EXISTING_STALE);
        manifest.assign(3, CacheCategory.NEW);

        assertThat(manifest.isFetchEligible(0)).isFalse();
        assertThat(manifest.isFetchEligible(1)).isTrue();
        assertThat(manifest.isFetchEligible(2)).isTrue();
        assertThat(manifest.isFetchEligible(3)).isTrue();
        assertThat(manifest.isFetchEligible(99)).isFalse();
    }

    @Test
    @DisplayName("keyed map form survives a round trip and ignores unknown keys")
    void keyedMapForm() {
        ClassificationManifest manifest = new ClassificationManifest();
        manifest.assign(4, CacheCategory.EXISTING_STALE);
        manifest.assign(2, CacheCategory.EXISTING_STALE);
        manifest.assign(7, CacheCategory.NEW);

        Map<String, List<Integer>> keyed = manifest.toKeyedMap();
        assertThat(keyed.get("existing_stale")).containsExactly(2, 4);

        ClassificationManifest restored = ClassificationManifest.fromKeyedMap(
                Map.of("existing_stale", List.of(2, 4), "new", List.of(7), "bogus", List.of(9)));
        assertThat(restored.categoryOf(7)).contains(CacheCategory.NEW);
        assertThat(restored.categoryOf(9)).isEmpty();
        assertThat(restored.counts().get(CacheCategory.EXISTING_STALE)).isEqualTo(2);
    }
}
