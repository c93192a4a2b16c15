package com.purchasingpower.research.service.search;

import com.google.common.base.Preconditions;
import com.purchasingpower.research.configuration.SearchProperties;
import com.purchasingpower.research.model.CallContext;
import com.purchasingpower.research.model.ServiceType;
import com.purchasingpower.research.model.research.SearchResult;
import com.purchasingpower.research.util.BackoffPolicy;
import com.purchasingpower.research.util.ExternalCallLogger;
import com.purchasingpower.research.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scrapes the DuckDuckGo HTML endpoint. No credentials needed.
 *
 * <p>Failed requests are retried with the search backoff policy. When every attempt fails the
 * provider returns an empty list.
 */
@Slf4j
public class DuckDuckGoSearchProvider implements SearchProvider {

    private final WebClient webClient;
    private final Duration timeout;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;

    public DuckDuckGoSearchProvider(SearchProperties props, WebClient.Builder webClientBuilder, Sleeper sleeper) {
        this.webClient = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create()
                        .followRedirect(true)
                        .responseTimeout(props.getTimeout())))
                .baseUrl(props.getDuckDuckGoBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .build();
        this.timeout = props.getTimeout();
        this.backoffPolicy = props.getRetry().toBackoffPolicy();
        this.sleeper = sleeper;
    }

    @Override
    public List<SearchResult> search(String query, int maxResults) {
        Preconditions.checkArgument(query != null && !query.isBlank(), "Query cannot be empty");
        Preconditions.checkArgument(maxResults > 0, "maxResults must be positive");

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.DUCKDUCKGO, "html-search", log);
        callCtx.logRequest(query, "Max Results", maxResults);

        for (int attempt = 0; ; attempt++) {
            try {
                String html = webClient.get()
                        .uri(uriBuilder -> uriBuilder.path("/html/").queryParam("q", query).build())
                        .retrieve()
                        .bodyToMono(String.class)
                        .timeout(timeout)
                        .block();

                List<SearchResult> results = parseResults(html, maxResults);
                callCtx.logResponse("Found " + results.size() + " results");
                return results;
            } catch (RuntimeException e) {
                if (!backoffPolicy.canRetryAfter(attempt)) {
                    callCtx.logError("All " + backoffPolicy.getMaxAttempts() + " search attempts failed for '"
                            + query + "': " + e.getMessage(), e);
                    return List.of();
                }
                Duration delay = backoffPolicy.delayBeforeRetry(attempt);
                callCtx.logRetry(attempt + 1, backoffPolicy.getMaxAttempts(), delay, e.getClass().getSimpleName());
                if (!pause(delay)) {
                    callCtx.logError("Interrupted while backing off", e);
                    return List.of();
                }
            }
        }
    }

    private boolean pause(Duration delay) {
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Organic results in page order, de-duplicated by target URL. Sponsored entries are skipped.
     */
    static List<SearchResult> parseResults(String html, int maxResults) {
        if (html == null || html.isBlank()) {
            return List.of();
        }

        Document doc = Jsoup.parse(html);
        Map<String, SearchResult> byUrl = new LinkedHashMap<>();

        for (Element result : doc.select("div.result")) {
            if (byUrl.size() >= maxResults) {
                break;
            }
            if (result.hasClass("result--ad")) {
                continue;
            }

            Element anchor = result.selectFirst("a.result__a");
            if (anchor == null) {
                continue;
            }
            String url = decodeRedirect(anchor.attr("href"));
            if (url == null || !url.startsWith("http")) {
                continue;
            }

            String snippet = result.select(".result__snippet").text();
            byUrl.putIfAbsent(url, SearchResult.builder()
                    .url(url)
                    .title(anchor.text())
                    .snippet(snippet)
                    .build());
        }
        return new ArrayList<>(byUrl.values());
    }

    /**
     * Resolves {@code //duckduckgo.com/l/?uddg=<encoded>} redirect links to their target.
     */
    static String decodeRedirect(String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        if (!href.contains("/l/?")) {
            return href;
        }

        String absolute = href.startsWith("//") ? "https:" + href
                : href.startsWith("/") ? "https://duckduckgo.com" + href
                : href;
        String rawQuery;
        try {
            rawQuery = URI.create(absolute).getRawQuery();
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable DuckDuckGo redirect {}: {}", href, e.getMessage());
            return null;
        }
        if (rawQuery == null) {
            return null;
        }
        for (String pair : rawQuery.split("&")) {
            String[] kv = pair.split("=", 2);
            if (kv.length == 2 && "uddg".equals(kv[0])) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    @Override
    public String getName() {
        return "duckduckgo";
    }
}
