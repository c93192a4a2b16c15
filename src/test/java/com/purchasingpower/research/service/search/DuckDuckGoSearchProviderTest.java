package com.purchasingpower.research.service.search;

import com.purchasingpower.research.configuration.SearchProperties;
import com.purchasingpower.research.model.research.SearchResult;
import com.purchasingpower.research.support.RecordingSleeper;
import com.purchasingpower.research.support.StubExchange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DuckDuckGo Search Provider Tests")
class DuckDuckGoSearchProviderTest {

    private static final String RESULTS_PAGE = """
            <html><body><div class="results">
              <div class="result results_links web-result result--ad">
                <h2 class="result__title"><a class="result__a" href="https://duckduckgo.com/y.js?ad_domain=shop.example">Buy now</a></h2>
                <a class="result__snippet">Sponsored</a>
              </div>
              <div class="result results_links web-result">
                <h2 class="result__title"><a class="result__a" href="//duckduckgo.com/l/?uddg=https%3A%2F%2Fexample.com%2Fjava%2Drecords&amp;rut=abc">Java Records Explained</a></h2>
                <a class="result__snippet">Records are immutable data carriers.</a>
              </div>
              <div class="result results_links web-result">
                <h2 class="result__title"><a class="result__a" href="https://docs.example.org/records">Records - Docs</a></h2>
                <a class="result__snippet">Official documentation.</a>
              </div>
              <div class="result results_links web-result">
                <h2 class="result__title"><a class="result__a" href="//duckduckgo.com/l/?uddg=https%3A%2F%2Fexample.com%2Fjava%2Drecords&amp;rut=def">Duplicate</a></h2>
              </div>
              <div class="result results_links web-result">
                <h2 class="result__title"><a class="result__a" href="https://third.example.net/">Third</a></h2>
              </div>
            </div></body></html>
            """;

    private SearchProperties props;
    private StubExchange exchange;
    private RecordingSleeper sleeper;

    @BeforeEach
    void setUp() {
        props = new SearchProperties();
        exchange = new StubExchange();
        sleeper = new RecordingSleeper();
    }

    private DuckDuckGoSearchProvider provider() {
        return new DuckDuckGoSearchProvider(props, exchange.builder(), sleeper);
    }

    @Test
    @DisplayName("Parses organic results, decodes redirects, drops ads and duplicates")
    void testSearch_ShouldParseOrganicResults() {
        // Given
        exchange.respondHtml(HttpStatus.OK, RESULTS_PAGE);

        // When
        List<SearchResult> results = provider().search("java records", 5);

        // Then
        assertThat(results).extracting(SearchResult::getUrl).containsExactly(
                "https://example.com/java-records",
                "https://docs.example.org/records",
                "https://third.example.net/");
        assertThat(results.get(0).getTitle()).isEqualTo("Java Records Explained");
        assertThat(results.get(0).getSnippet()).isEqualTo("Records are immutable data carriers.");

        var request = exchange.getRequests().get(0);
        assertThat(request.url().getPath()).isEqualTo("/html/");
        assertThat(request.url().getQuery()).isEqualTo("q=java records");
        assertThat(request.headers().getFirst(HttpHeaders.USER_AGENT)).isEqualTo(props.getUserAgent());
    }

    @Test
    @DisplayName("Result count is capped at maxResults")
    void testSearch_ShouldCapResults() {
        exchange.respondHtml(HttpStatus.OK, RESULTS_PAGE);

        assertThat(provider().search("java records", 2)).hasSize(2);
    }

    @Test
    @DisplayName("Transient failure is retried with backoff")
    void testSearch_ShouldRetryThenSucceed() {
        // Given
        exchange.respondHtml(HttpStatus.SERVICE_UNAVAILABLE, "busy")
                .respondHtml(HttpStatus.OK, RESULTS_PAGE);

        // When
        List<SearchResult> results = provider().search("java records", 5);

        // Then
        assertThat(results).hasSize(3);
        assertThat(exchange.getRequestCount()).isEqualTo(2);
        assertThat(sleeper.getDelays()).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Exhausted retries return an empty list")
    void testSearch_ShouldReturnEmptyAfterRetries() {
        exchange.respondHtml(HttpStatus.TOO_MANY_REQUESTS, "slow down");

        List<SearchResult> results = provider().search("java records", 5);

        assertThat(results).isEmpty();
        assertThat(exchange.getRequestCount()).isEqualTo(3);
        assertThat(sleeper.getDelays()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("Page without results is an empty list")
    void testSearch_ShouldHandleNoResults() {
        exchange.respondHtml(HttpStatus.OK, "<html><body><div class=\"no-results\">No results.</div></body></html>");

        assertThat(provider().search("zzzz", 5)).isEmpty();
        assertThat(sleeper.getDelays()).isEmpty();
    }

    @Test
    @DisplayName("Redirect decoding")
    void testDecodeRedirect() {
        assertThat(DuckDuckGoSearchProvider.decodeRedirect("/l/?uddg=https%3A%2F%2Fa.example%2Fx%3Fy%3D1"))
                .isEqualTo("https://a.example/x?y=1");
        assertThat(DuckDuckGoSearchProvider.decodeRedirect("https://plain.example/")).isEqualTo("https://plain.example/");
        assertThat(DuckDuckGoSearchProvider.decodeRedirect("//duckduckgo.com/l/?rut=abc")).isNull();
        assertThat(DuckDuckGoSearchProvider.decodeRedirect("")).isNull();
    }
}
