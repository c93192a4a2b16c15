package com.purchasingpower.research.service.search;

import com.google.common.base.Preconditions;
import com.purchasingpower.research.configuration.FetchProperties;
import com.purchasingpower.research.configuration.ResearchProperties;
import com.purchasingpower.research.model.CallContext;
import com.purchasingpower.research.model.ServiceType;
import com.purchasingpower.research.util.BackoffPolicy;
import com.purchasingpower.research.util.ExternalCallLogger;
import com.purchasingpower.research.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Downloads a page and reduces it to readable plain text.
 *
 * <p>Redirects are followed. Only HTML, XHTML and plain text bodies are read; a response without
 * a Content-Type is parsed as HTML. 5xx responses and timeouts are retried with backoff. 4xx
 * responses are final. Every unrecoverable condition yields {@link Optional#empty()}, so a bad
 * page never stops a run.
 */
@Slf4j
@Service
public class ContentFetcher {

    private static final String BOILERPLATE = "script, style, noscript, nav, header, footer, aside, form, iframe";

    private static final List<MediaType> READABLE_TYPES =
            List.of(MediaType.TEXT_HTML, MediaType.APPLICATION_XHTML_XML, MediaType.TEXT_PLAIN);

    private final WebClient webClient;
    private final Duration timeout;
    private final int maxContentWords;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;

    public ContentFetcher(ResearchProperties props, WebClient.Builder webClientBuilder, Sleeper sleeper) {
        FetchProperties fetch = props.getFetch();
        this.webClient = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create()
                        .followRedirect(true)
                        .responseTimeout(fetch.getTimeout())))
                .defaultHeader(HttpHeaders.USER_AGENT, fetch.getUserAgent())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(fetch.getMaxPageBytes()))
                        .build())
                .build();
        this.timeout = fetch.getTimeout();
        this.maxContentWords = fetch.getMaxContentWords();
        this.backoffPolicy = fetch.getRetry().toBackoffPolicy();
        this.sleeper = sleeper;
    }

    /**
     * Fetch {@code url} and return its readable text, truncated to the configured word budget.
     *
     * @return the text, or empty when the page could not be fetched or has no readable text
     */
    public Optional<String> fetch(String url) {
        Preconditions.checkArgument(url != null && !url.isBlank(), "URL cannot be empty");

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.WEB, "fetch", log);
        callCtx.logRequest(url);

        for (int attempt = 0; ; attempt++) {
            String reason;
            try {
                ResponseEntity<String> response = webClient.get()
                        .uri(URI.create(url))
                        .retrieve()
                        .toEntity(String.class)
                        .timeout(timeout)
                        .block();

                if (response == null) {
                    log.warn("Empty response from {}", url);
                    return Optional.empty();
                }
                if (response.getStatusCode().is3xxRedirection()) {
                    log.warn("Redirect ({}) not resolved for {}", response.getStatusCode().value(), url);
                    return Optional.empty();
                }
                MediaType contentType = response.getHeaders().getContentType();
                if (!isReadable(contentType)) {
                    log.warn("Skipping non-text content ({}): {}", contentType, url);
                    return Optional.empty();
                }

                Optional<String> text = extractReadableText(response.getBody(), maxContentWords);
                if (text.isEmpty()) {
                    log.warn("No content extracted from {}", url);
                } else {
                    callCtx.logResponse("Fetched " + text.get().length() + " characters");
                }
                return text;
            } catch (Exception raw) {
                Throwable e = Exceptions.unwrap(raw);
                if (e instanceof WebClientResponseException response) {
                    int status = response.getStatusCode().value();
                    if (status < 500) {
                        logClientError(status, url);
                        return Optional.empty();
                    }
                    reason = "Server error (" + status + ")";
                } else if (isTimeout(e)) {
                    reason = "Timeout";
                } else {
                    callCtx.logError("Request error for " + url + ": " + e.getMessage(), e);
                    return Optional.empty();
                }
            }

            if (!backoffPolicy.canRetryAfter(attempt)) {
                log.warn("All {} fetch attempts failed for {} (last: {})", backoffPolicy.getMaxAttempts(), url, reason);
                return Optional.empty();
            }
            Duration delay = backoffPolicy.delayBeforeRetry(attempt);
            callCtx.logRetry(attempt + 1, backoffPolicy.getMaxAttempts(), delay, reason);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting to refetch {}", url);
                return Optional.empty();
            }
        }
    }

    private void logClientError(int status, String url) {
        if (status == 404) {
            log.warn("Page not found (404): {}", url);
        } else if (status == 403) {
            log.warn("Access denied (403), likely paywall: {}", url);
        } else {
            log.warn("HTTP error ({}): {}", status, url);
        }
    }

    static boolean isReadable(MediaType contentType) {
        if (contentType == null) {
            return true;
        }
        return READABLE_TYPES.stream().anyMatch(type -> type.isCompatibleWith(contentType));
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    /**
     * Strips boilerplate elements, prefers {@code article}, then {@code main}, then {@code body},
     * collapses whitespace and keeps at most {@code maxWords} words.
     */
    static Optional<String> extractReadableText(String html, int maxWords) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }

        Document doc = Jsoup.parse(html);
        doc.select(BOILERPLATE).remove();

        String text = "";
        for (String selector : new String[] {"article", "main", "body"}) {
            Element element = doc.selectFirst(selector);
            if (element != null) {
                text = element.text().replaceAll("\\s+", " ").trim();
                if (!text.isEmpty()) {
                    break;
                }
            }
        }
        if (text.isEmpty()) {
            return Optional.empty();
        }

        String[] words = text.split(" ");
        if (words.length > maxWords) {
            log.info("Truncating content from {} to {} words", words.length, maxWords);
            text = String.join(" ", Arrays.copyOf(words, maxWords));
        }
        return Optional.of(text);
    }
}
