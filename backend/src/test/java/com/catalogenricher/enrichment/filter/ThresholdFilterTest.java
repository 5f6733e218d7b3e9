package com.catalogenricher.enrichment.filter;

import com.catalogenricher.domain.RecordStatus;
import com.catalogenricher.domain.WorkingTable;
import com.catalogenricher.enrichment.TestTables;
import com.catalogenricher.enrichment.config.EnrichmentConfigurationException;
import com.catalogenricher.enrichment.config.ThresholdFilterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ThresholdFilterTest {

    private static final List<String> COLUMNS = List.of("barcode", "isbn", "rating", "rating_count", "call_number", "title");
    private static final FilterColumns FILTER_COLUMNS = new FilterColumns("rating", "rating_count", "call_number");

    private ThresholdFilterProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ThresholdFilterProperties();
        properties.getCategoryMinScores().put("H", 7.5);
    }

    /**
     * 50 rows in category H: review counts 2, 4, ..., 100; ratings 7.0 for the first 30, 8.6 for the next 10,
     * 9.0 for the last 10.
     */
    private static WorkingTable categoryH() {
        List<String[]> rows = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            String rating = i < 30 ? "7.0" : i < 40 ? "8.6" : "9.0";
            rows.add(new String[]{"B" + i, "", rating, String.valueOf(2 * i + 2), "H31/" + i, "Book " + i});
        }
        return TestTables.of(COLUMNS, rows.toArray(new String[0][]));
    }

    @Test
    @DisplayName("large group: review band P40..P80, threshold max(floor, P75 rating)")
    void largeGroupThresholds() {
        ThresholdFilter filter = new ThresholdFilter(properties);

        DynamicFilterResult result = filter.analyze(categoryH(), FILTER_COLUMNS);

        assertThat(result.totalSamples()).isEqualTo(50);
        CategoryStats h = result.stats().get(0);
        assertThat(h.category()).isEqualTo("H");
        assertThat(h.sampleType()).isEqualTo(SampleType.LARGE);
        assertThat(h.reviewLower()).isCloseTo(41.2, within(1e-9));
        assertThat(h.reviewUpper()).isCloseTo(80.4, within(1e-9));
        assertThat(h.ratingPercentile()).isCloseTo(8.6, within(1e-9));
        assertThat(h.threshold()).isCloseTo(8.6, within(1e-9));
        assertThat(result.candidateRowIds()).containsExactlyElementsOf(IntStream.range(30, 40).boxed().toList());
        assertThat(h.candidateCount()).isEqualTo(10);
        assertThat(h.ratioInGroup()).isCloseTo(0.2, within(1e-9));
        assertThat(h.ratioOverall()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    @DisplayName("small group uses the category floor as threshold")
    void smallGroupUsesFloor() {
        WorkingTable table = TestTables.of(COLUMNS,
                new String[]{"B0", "", "8.1", "10", "I247.5", "a"},
                new String[]{"B1", "", "7.9", "20", "I247.5", "b"},
                new String[]{"B2", "", "8.5", "30", "I247.5", "c"});
        ThresholdFilter filter = new ThresholdFilter(properties);

        DynamicFilterResult result = filter.analyze(table, FILTER_COLUMNS);

        CategoryStats i = result.stats().get(0);
        assertThat(i.sampleType()).isEqualTo(SampleType.SMALL);
        assertThat(i.ratingPercentile()).isNull();
        assertThat(i.threshold()).isEqualTo(8.0);
        // band P40..P80 of [10, 20, 30] is [18, 26]: only row 1 is in band, and it is below the floor
        assertThat(result.candidateRowIds()).isEmpty();
    }

    @Test
    @DisplayName("rows without a numeric rating are not samples; unknown category sorts last")
    void samplesAndOrdering() {
        WorkingTable table = TestTables.of(COLUMNS,
                new String[]{"B0", "", "9.1", "1,200", "", "a"},
                new String[]{"B1", "", "", "50", "K81", "b"},
                new String[]{"B2", "", "n/a", "50", "K81", "c"},
                new String[]{"B3", "", "8.0", "12", "k81", "d"},
                new String[]{"B4", "", "8.0", "", "B9", "e"});
        ThresholdFilter filter = new ThresholdFilter(properties);

        DynamicFilterResult result = filter.analyze(table, FILTER_COLUMNS);

        assertThat(result.totalSamples()).isEqualTo(3);
        assertThat(result.stats()).extracting(CategoryStats::category).containsExactly("B", "K", "unknown");
        CategoryStats b = result.stats().get(0);
        assertThat(b.reviewLower()).isNull();
        assertThat(b.candidateCount()).isNull();
        assertThat(b.ratioInGroup()).isNaN();
        assertThat(result.candidateRowIds()).containsExactly(0, 3);
    }

    @Test
    @DisplayName("analysis is deterministic and does not touch row status")
    void deterministic() {
        WorkingTable table = categoryH();
        ThresholdFilter filter = new ThresholdFilter(properties);

        DynamicFilterResult first = filter.analyze(table, FILTER_COLUMNS);
        DynamicFilterResult second = filter.analyze(table, FILTER_COLUMNS);

        assertThat(second.candidateRowIds()).isEqualTo(first.candidateRowIds());
        assertThat(second.stats()).isEqualTo(first.stats());
        assertThat(table.records()).allSatisfy(r -> assertThat(r.getStatus()).isEqualTo(RecordStatus.PENDING));
    }

    @Test
    @DisplayName("active column rules must all pass")
    void columnRules() {
        ThresholdFilterProperties.Rule notEmpty = new ThresholdFilterProperties.Rule();
        notEmpty.setColumn("title");
        notEmpty.setEnabled(true);
        ThresholdFilterProperties.Rule regex = new ThresholdFilterProperties.Rule();
        regex.setColumn("isbn");
        regex.setFilterType("regex");
        regex.setPattern("978");
        regex.setEnabled(true);
        ThresholdFilterProperties.Rule switchedOff = new ThresholdFilterProperties.Rule();
        switchedOff.setColumn("call_number");
        properties.getColumnFilters().setEnabled(true);
        properties.getColumnFilters().setRules(List.of(notEmpty, regex, switchedOff));
        WorkingTable table = TestTables.of(COLUMNS,
                new String[]{"B0", "9787111111111", "9.0", "10", "", "a"},
                new String[]{"B1", "9787111111111", "9.0", "10", "", ""},
                new String[]{"B2", "7111111111", "9.0", "10", "", "c"});
        ThresholdFilter filter = new ThresholdFilter(properties);

        DynamicFilterResult result = filter.analyze(table, FILTER_COLUMNS);

        assertThat(filter.getColumnRules()).hasSize(2);
        assertThat(result.settings().activeColumnRules()).isEqualTo(2);
        assertThat(result.candidateRowIds()).containsExactly(0);
    }

    @Test
    @DisplayName("rules apply only once switched on")
    void rulesDefaultToDisabled() {
        ThresholdFilterProperties.Rule notEmpty = new ThresholdFilterProperties.Rule();
        notEmpty.setColumn("title");
        properties.getColumnFilters().setEnabled(true);
        properties.getColumnFilters().setRules(List.of(notEmpty));
        WorkingTable table = TestTables.of(COLUMNS,
                new String[]{"B0", "9787111111111", "9.0", "10", "", ""});
        ThresholdFilter filter = new ThresholdFilter(properties);

        DynamicFilterResult result = filter.analyze(table, FILTER_COLUMNS);

        assertThat(notEmpty.isEnabled()).isFalse();
        assertThat(filter.getColumnRules()).isEmpty();
        assertThat(result.candidateRowIds()).containsExactly(0);
    }

    @Test
    @DisplayName("a rating written with a thousands separator is not scored")
    void separatedRatingIsNotASample() {
        WorkingTable table = TestTables.of(COLUMNS,
                new String[]{"B0", "9787111111111", "9.0", "10", "I247", ""},
                new String[]{"B1", "9787222222222", "9,0", "10", "I247", ""});

        DynamicFilterResult result = new ThresholdFilter(properties).analyze(table, FILTER_COLUMNS);

        assertThat(result.totalSamples()).isEqualTo(1);
        assertThat(result.candidateRowIds()).containsExactly(0);
    }

    @Test
    @DisplayName("invalid regex rule fails at construction")
    void invalidRegexFailsFast() {
        ThresholdFilterProperties.Rule regex = new ThresholdFilterProperties.Rule();
        regex.setColumn("isbn");
        regex.setFilterType("regex");
        regex.setPattern("([");
        regex.setEnabled(true);
        properties.getColumnFilters().setEnabled(true);
        properties.getColumnFilters().setRules(List.of(regex));

        assertThatThrownBy(() -> new ThresholdFilter(properties)).isInstanceOf(EnrichmentConfigurationException.class);
    }

    @Test
    @DisplayName("markers are written for candidates and cleared elsewhere")
    void candidateMarkers() {
        WorkingTable table = categoryH();
        table.get(0).setValue("candidate", "candidate");
        ThresholdFilter filter = new ThresholdFilter(properties);

        filter.applyCandidateMarkers(table, filter.analyze(table, FILTER_COLUMNS), "candidate");

        assertThat(table.columns()).contains("candidate");
        assertThat(table.get(0).getValue("candidate")).isEmpty();
        assertThat(table.get(35).getValue("candidate")).isEqualTo("candidate");
    }

    @Test
    @DisplayName("plain numbers parse; separators, junk and infinities do not")
    void parseNumber() {
        assertThat(ThresholdFilter.parseNumber("1234")).isEqualTo(1234.0);
        assertThat(ThresholdFilter.parseNumber("1,234")).isNull();
        assertThat(ThresholdFilter.parseNumber(" 8.6 ")).isEqualTo(8.6);
        assertThat(ThresholdFilter.parseNumber("abc")).isNull();
        assertThat(ThresholdFilter.parseNumber("Infinity")).isNull();
        assertThat(ThresholdFilter.parseNumber("")).isNull();
    }
}
