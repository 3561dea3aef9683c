package com.intention.template;

import com.intention.config.IntentionProperties;
import com.intention.exception.TemplateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for storing and retrieving templates by name.
 *
 * <p>Populated from {@link PromptTemplate} beans and from {@code intention.templates.*}
 * configuration. Registering a name again replaces the previous template.</p>
 */
@Slf4j
@Component
public class TemplateRegistry {

    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();

    public TemplateRegistry() {
    }

    @Autowired
    public TemplateRegistry(IntentionProperties properties, ObjectProvider<PromptTemplate> templateBeans) {
        templateBeans.orderedStream().forEach(this::register);
        properties.getTemplates().forEach((name, config) -> register(fromConfig(name, config)));
        log.info("Initialized TemplateRegistry with {} templates: {}", templates.size(), list());
    }

    public void register(PromptTemplate template) {
        PromptTemplate previous = templates.put(template.getName(), template);
        if (previous != null) {
            log.warn("Template '{}' re-registered, version {} replaces {}", template.getName(),
                    template.getMetadata().getVersion(), previous.getMetadata().getVersion());
        }
    }

    /**
     * @throws TemplateException if no template has that name
     */
    public PromptTemplate get(String name) {
        PromptTemplate template = name == null ? null : templates.get(name);
        if (template == null) {
            throw new TemplateException("Template not found: " + name);
        }
        return template;
    }

    public List<String> list() {
        List<String> names = new ArrayList<>(templates.keySet());
        Collections.sort(names);
        return names;
    }

    static PromptTemplate fromConfig(String name, IntentionProperties.TemplateConfig config) {
        TemplateMetadata metadata = TemplateMetadata.builder()
                .name(name)
                .description(config.getDescription())
                .version(config.getVersion())
                .build();

        TemplateSettings settings = TemplateSettings.builder()
                .provider(config.getProvider())
                .model(config.getModel())
                .parameters(config.getParameters())
                .ttl(config.getTtl())
                .maxRetries(config.getMaxRetries())
                .maxRepairAttempts(config.getMaxRepairAttempts())
                .build();

        return new PatternPromptTemplate(metadata, config.getInput(), config.getOutput(), settings,
                config.getPrompt(), config.getSystem());
    }
}
