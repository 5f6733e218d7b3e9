package com.catalogenricher.enrichment.fetch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadMapperTest {

    private static final String BOOK = """
            {
              "title": "沙丘",
              "subtitle": "",
              "author": ["弗兰克·赫伯特"],
              "translator": ["潘振华", "刘佳"],
              "press": ["江苏凤凰文艺出版社"],
              "producers": [{"name": "读客文化"}],
              "book_series": {"title": "沙丘系列"},
              "price": ["79.00元"],
              "isbn13": "9787559416155",
              "pages": ["552"],
              "pubdate": ["2017-2"],
              "rating": {"value": 8.8, "count": 12034},
              "intro": "一个关于沙漠星球的故事",
              "cover_url": "https://img/s29.jpg",
              "url": "https://book.example/subject/1/"
            }
            """;

    @Test
    @DisplayName("maps source keys to logical fields, joins lists and extracts the year")
    void mapsFields() {
        MetadataLookup lookup = PayloadMapper.parse("9787559416155", BOOK);

        assertThat(lookup.isFound()).isTrue();
        Map<String, String> fields = lookup.payload().fields();
        assertThat(fields)
                .containsEntry("title", "沙丘")
                .containsEntry("author", "弗兰克·赫伯特")
                .containsEntry("translator", "潘振华 / 刘佳")
                .containsEntry("publisher", "江苏凤凰文艺出版社")
                .containsEntry("producer", "读客文化")
                .containsEntry("series", "沙丘系列")
                .containsEntry("isbn", "9787559416155")
                .containsEntry("pub_year", "2017")
                .containsEntry("rating", "8.8")
                .containsEntry("rating_count", "12034")
                .containsEntry("summary", "一个关于沙漠星球的故事")
                .containsEntry("cover_image", "https://img/s29.jpg")
                .containsEntry("url", "https://book.example/subject/1/")
                .doesNotContainKey("subtitle");
    }

    @Test
    @DisplayName("zero rating is treated as no rating")
    void zeroRatingDropped() {
        MetadataLookup lookup = PayloadMapper.parse("x", "{\"title\":\"t\",\"rating\":{\"value\":0,\"count\":3}}");
        assertThat(lookup.payload().fields()).doesNotContainKey("rating").containsEntry("rating_count", "3");
    }

    @Test
    @DisplayName("cover falls back to pic.large")
    void coverFallback() {
        MetadataLookup lookup = PayloadMapper.parse("x", "{\"title\":\"t\",\"pic\":{\"large\":\"L\",\"normal\":\"N\"}}");
        assertThat(lookup.payload().fields()).containsEntry("cover_image", "L");
    }

    @Test
    @DisplayName("business error codes and invalid_request messages mean not found")
    void businessErrors() {
        assertThat(PayloadMapper.parse("x", "{\"code\":1287,\"msg\":\"book_not_found\"}").outcome())
                .isEqualTo(MetadataLookup.Outcome.NOT_FOUND);
        assertThat(PayloadMapper.parse("x", "{\"code\":999,\"msg\":\"invalid_request_1000\"}").outcome())
                .isEqualTo(MetadataLookup.Outcome.NOT_FOUND);
    }

    @Test
    @DisplayName("payload without a title is not found")
    void noTitle() {
        MetadataLookup lookup = PayloadMapper.parse("x", "{\"author\":[\"a\"]}");
        assertThat(lookup.outcome()).isEqualTo(MetadataLookup.Outcome.NOT_FOUND);
        assertThat(lookup.reason()).isEqualTo("payload without title");
    }

    @Test
    @DisplayName("malformed JSON is a permanent failure")
    void malformed() {
        assertThatThrownBy(() -> PayloadMapper.parse("x", "<html>blocked</html>"))
                .isInstanceOf(MetadataSourceException.class)
                .satisfies(e -> assertThat(((MetadataSourceException) e).isRetryable()).isFalse());
    }
}
