package com.purchasingpower.research.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.research.exception.ResearchConfigurationException;
import com.purchasingpower.research.model.prompt.PromptTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt Library Service
 *
 * Loads prompts from {@code classpath:prompts/*.yaml} and renders them with Mustache.
 * Templates use triple braces for inserted text so page content is passed through unescaped.
 *
 * Usage:
 * String prompt = promptLibrary.render("extract", Map.of(
 *     "question", question,
 *     "url", source.getUrl(),
 *     "content", content
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    public static final String DECOMPOSE = "decompose";
    public static final String EXTRACT = "extract";
    public static final String SYNTHESIZE = "synthesize";

    private static final List<String> REQUIRED = List.of(DECOMPOSE, EXTRACT, SYNTHESIZE);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources("classpath:prompts/*.yaml");
        } catch (IOException e) {
            throw new ResearchConfigurationException("Prompt library initialization failed: " + e.getMessage());
        }

        for (Resource resource : resources) {
            try {
                PromptTemplate template = yamlMapper.readValue(resource.getInputStream(), PromptTemplate.class);
                String fullPrompt = template.getSystemPrompt() + "\n\n" + template.getUserPrompt();

                templates.put(template.getName(), template);
                compiled.put(template.getName(),
                        mustacheFactory.compile(new StringReader(fullPrompt), template.getName()));
                log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            } catch (IOException e) {
                log.error("Failed to load prompt template {}", resource.getFilename(), e);
                throw new ResearchConfigurationException(
                        "Invalid prompt template " + resource.getFilename() + ": " + e.getMessage());
            }
        }

        for (String name : REQUIRED) {
            if (!templates.containsKey(name)) {
                throw new ResearchConfigurationException("Missing prompt template: prompts/" + name + ".yaml");
            }
        }
        log.info("Loaded {} prompt templates", templates.size());
    }

    /**
     * Render a prompt with variables
     */
    public String render(String templateName, Map<String, Object> variables) {
        Mustache mustache = compiled.get(templateName);
        if (mustache == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }

        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }

    public PromptTemplate getTemplate(String name) {
        return templates.get(name);
    }
}
