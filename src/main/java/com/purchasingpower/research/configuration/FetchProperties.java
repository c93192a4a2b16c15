package com.purchasingpower.research.configuration;

import com.purchasingpower.research.config.RetryProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

@Data
public class FetchProperties {

    @NotNull
    private Duration timeout = Duration.ofSeconds(10);

    /**
     * Extracted page text is cut to this many words.
     */
    @Positive
    private int maxContentWords = 5000;

    @Positive
    private int maxPageBytes = 16 * 1024 * 1024;

    @NotBlank
    private String userAgent = "Mozilla/5.0 (compatible; ResearchAssistant/1.0)";

    @Valid
    @NestedConfigurationProperty
    private RetryProperties retry = new RetryProperties(2);
}
