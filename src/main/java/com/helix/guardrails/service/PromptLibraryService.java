package com.helix.guardrails.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.helix.guardrails.budget.ModelProfileResolver;
import com.helix.guardrails.exception.ConfigurationException;
import com.helix.guardrails.exception.ResourceNotFoundException;
import com.helix.guardrails.model.PromptTemplate;
import com.helix.guardrails.model.RenderedPrompt;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads YAML prompt templates and renders them with Mustache.
 *
 * <p>Values are inserted verbatim (no HTML escaping): prompts carry diffs and code.
 * Under small-model profiles a template's simplified variant is used when it has one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromptLibraryService {

    static final String PROMPT_LOCATION = "classpath:prompts/*.yaml";

    private final ModelProfileResolver profileResolver;

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new RawMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(PROMPT_LOCATION);
            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(resource.getInputStream(), PromptTemplate.class);
                if (template.getName() == null || template.getUserPrompt() == null) {
                    throw new ConfigurationException("Prompt file " + resource.getFilename()
                            + " must define name and userPrompt");
                }
                templates.put(template.getName(), template);
                log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            }
            log.info("Loaded {} prompt templates", templates.size());
        } catch (IOException e) {
            throw new ConfigurationException("Prompt library initialization failed: " + e.getMessage());
        }
    }

    /**
     * Render a template for the active profile.
     */
    public RenderedPrompt render(String templateName, Map<String, Object> variables) {
        return render(templateName, variables, profileResolver.isSlm());
    }

    public RenderedPrompt render(String templateName, Map<String, Object> variables, boolean simplified) {
        PromptTemplate template = templates.get(templateName);
        if (template == null) {
            throw new ResourceNotFoundException("Prompt template", templateName);
        }
        String system = template.systemFor(simplified);
        return new RenderedPrompt(
                system == null ? "" : renderText(templateName + ".system", system, variables),
                renderText(templateName + ".user", template.userFor(simplified), variables));
    }

    public PromptTemplate getTemplate(String name) {
        return templates.get(name);
    }

    private String renderText(String name, String text, Map<String, Object> variables) {
        Mustache mustache = mustacheFactory.compile(new StringReader(text), name);
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }

    private static class RawMustacheFactory extends DefaultMustacheFactory {
        @Override
        public void encode(String value, Writer writer) {
            try {
                writer.write(value);
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }
    }
}
