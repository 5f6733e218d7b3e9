package com.catalogenricher.enrichment.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps the book lookup JSON to logical metadata fields. List values are joined with " / ".
 */
public final class PayloadMapper {

    static final String LIST_SEPARATOR = " / ";

    /** Business error codes the source returns with HTTP 200 for unknown or rejected identifiers. */
    static final Set<Integer> NOT_FOUND_CODES = Set.of(1287, 1284);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern YEAR = Pattern.compile("(\\d{4})");

    private PayloadMapper() {
    }

    /**
     * Interprets a 200 response body.
     *
     * @throws MetadataSourceException (non-retryable) when the body is not JSON
     */
    static MetadataLookup parse(String identifier, String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            throw new MetadataSourceException("Malformed payload for " + identifier + ": " + e.getOriginalMessage(), false, e);
        }
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw new MetadataSourceException("Unexpected payload for " + identifier, false);
        }
        Optional<String> businessError = businessError(root);
        if (businessError.isPresent()) {
            return MetadataLookup.notFound(businessError.get());
        }
        Map<String, String> fields = mapFields(root);
        if (!fields.containsKey("title")) {
            return MetadataLookup.notFound("payload without title");
        }
        return MetadataLookup.found(new MetadataPayload(identifier, fields));
    }

    static Optional<String> businessError(JsonNode root) {
        JsonNode code = root.path("code");
        if (code.canConvertToInt() && NOT_FOUND_CODES.contains(code.asInt())) {
            return Optional.of("source error code " + code.asInt());
        }
        String msg = root.path("msg").asText("");
        if (msg.contains("invalid_request")) {
            return Optional.of("source rejected request: " + msg);
        }
        return Optional.empty();
    }

    static Map<String, String> mapFields(JsonNode root) {
        Map<String, String> fields = new LinkedHashMap<>();
        put(fields, "title", text(root, "title"));
        put(fields, "subtitle", text(root, "subtitle"));
        put(fields, "original_title", text(root, "original_title", "origin_title"));
        put(fields, "author", text(root, "author"));
        put(fields, "translator", text(root, "translator"));
        put(fields, "publisher", text(root, "press", "publisher"));
        put(fields, "producer", text(root, "producers", "producer"));
        put(fields, "series", text(root, "book_series", "series"));
        put(fields, "price", text(root, "price"));
        put(fields, "isbn", text(root, "isbn13", "isbn10", "isbn"));
        put(fields, "pages", text(root, "pages"));
        put(fields, "binding", text(root, "binding"));
        put(fields, "pub_year", year(text(root, "pubdate", "pub_year")));
        JsonNode rating = root.path("rating");
        if (rating.isObject()) {
            JsonNode value = rating.path("value");
            if (value.isNumber() && value.asDouble() > 0) {
                put(fields, "rating", value.asText());
            }
            JsonNode count = rating.path("count");
            if (count.canConvertToLong()) {
                put(fields, "rating_count", Long.toString(count.asLong()));
            }
        }
        put(fields, "summary", text(root, "intro", "summary"));
        put(fields, "author_intro", text(root, "author_intro"));
        put(fields, "catalog", text(root, "catalog"));
        String cover = text(root, "cover_url", "image");
        if (cover == null) {
            cover = text(root.path("pic"), "large", "normal");
        }
        put(fields, "cover_image", cover);
        put(fields, "url", text(root, "url", "sharing_url"));
        return fields;
    }

    private static void put(Map<String, String> fields, String key, String value) {
        if (value != null && !value.isBlank()) {
            fields.put(key, value.strip());
        }
    }

    /**
     * Text of the first present, non-empty key among {@code keys}.
     */
    private static String text(JsonNode node, String... keys) {
        for (String key : keys) {
            String value = render(node.path(key));
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String render(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode element : node) {
                String part = render(element);
                if (part != null && !part.isBlank()) {
                    parts.add(part.strip());
                }
            }
            return parts.isEmpty() ? null : String.join(LIST_SEPARATOR, parts);
        }
        if (node.isObject()) {
            String named = render(node.path("title"));
            return named != null ? named : render(node.path("name"));
        }
        return node.asText();
    }

    private static String year(String pubdate) {
        if (pubdate == null) {
            return null;
        }
        Matcher m = YEAR.matcher(pubdate);
        return m.find() ? m.group(1) : null;
    }
}
