package com.purchasingpower.research.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class ResearchProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private LlmProperties llm = new LlmProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SearchProperties search = new SearchProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private FetchProperties fetch = new FetchProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private AgentProperties agent = new AgentProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private OutputProperties output = new OutputProperties();
}
