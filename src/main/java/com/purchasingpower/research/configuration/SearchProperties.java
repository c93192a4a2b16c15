package com.purchasingpower.research.configuration;

import com.purchasingpower.research.config.RetryProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Web search settings.
 *
 * <p>{@code provider} is one of:
 * <ul>
 *   <li>{@code auto} - DuckDuckGo first, Google Custom Search when DuckDuckGo finds nothing</li>
 *   <li>{@code duckduckgo} - DuckDuckGo only</li>
 *   <li>{@code google} - Google Custom Search only (credentials required)</li>
 * </ul>
 */
@Data
public class SearchProperties {

    @NotBlank
    private String provider = "auto";

    @Positive
    private int maxResultsPerQuery = 5;

    @NotNull
    private Duration timeout = Duration.ofSeconds(10);

    @NotBlank
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

    @NotBlank
    private String duckDuckGoBaseUrl = "https://html.duckduckgo.com";

    @NotBlank
    private String googleBaseUrl = "https://www.googleapis.com";

    private String googleApiKey;

    private String googleCseId;

    @Valid
    @NestedConfigurationProperty
    private RetryProperties retry = new RetryProperties();

    public boolean hasGoogleCredentials() {
        return googleApiKey != null && !googleApiKey.isBlank()
                && googleCseId != null && !googleCseId.isBlank();
    }
}
