package com.catalogenricher.enrichment.fetch;

import com.catalogenricher.enrichment.config.FetchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Book lookup over HTTP via WebClient. Status handling:
 * 200 → parse payload (business error codes mean not found); 404 → not found;
 * 429/500/502/503, timeouts and I/O errors → retryable failure; anything else → non-retryable failure.
 */
@Component
@Slf4j
public class WebClientMetadataSource implements MetadataSource {

    static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503);

    static final List<String> DEFAULT_USER_AGENTS = List.of(
            "Mozilla/5.0 (iPhone; CPU iPhone OS 16_6 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/16.6 Mobile/15E148 Safari/604.1",
            "Mozilla/5.0 (Linux; Android 13; Pixel 7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Mobile Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Safari/605.1.15",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"
    );

    private static final String REFERER = "https://m.douban.com/";

    private final FetchProperties fetchProperties;
    private final WebClient webClient;
    private final List<String> userAgents;
    private final AtomicInteger userAgentCursor = new AtomicInteger();

    public WebClientMetadataSource(FetchProperties fetchProperties, WebClient.Builder webClientBuilder) {
        this.fetchProperties = fetchProperties;
        this.webClient = webClientBuilder
                .codecs(c -> c.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
                .build();
        List<String> configured = fetchProperties.getUserAgents();
        this.userAgents = configured == null || configured.isEmpty() ? DEFAULT_USER_AGENTS : List.copyOf(configured);
    }

    @Override
    public CompletableFuture<MetadataLookup> fetchByIdentifier(String identifier, Duration timeout) {
        String url = fetchProperties.getBaseUrl() + "/" + identifier;
        return webClient.get()
                .uri(url)
                .header(HttpHeaders.USER_AGENT, nextUserAgent())
                .header(HttpHeaders.REFERER, REFERER)
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> interpret(identifier, response.statusCode().value(), body)))
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof MetadataSourceException),
                        e -> new MetadataSourceException("Lookup " + identifier + " failed: " + describe(e), true, e))
                .toFuture();
    }

    static MetadataLookup interpret(String identifier, int status, String body) {
        if (status == 200) {
            return PayloadMapper.parse(identifier, body);
        }
        if (status == 404) {
            return MetadataLookup.notFound("http 404");
        }
        if (RETRYABLE_STATUSES.contains(status)) {
            throw new MetadataSourceException("Lookup " + identifier + " got http " + status, true);
        }
        throw new MetadataSourceException("Lookup " + identifier + " got http " + status, false);
    }

    String nextUserAgent() {
        int i = Math.floorMod(userAgentCursor.getAndIncrement(), userAgents.size());
        return userAgents.get(i);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
