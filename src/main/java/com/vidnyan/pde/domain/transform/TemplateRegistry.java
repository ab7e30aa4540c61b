package com.vidnyan.pde.domain.transform;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Template name to template tree.
 */
@Slf4j
public class TemplateRegistry {

    private final Map<String, PatternTemplate> templates = new ConcurrentHashMap<>();

    public TemplateRegistry register(PatternTemplate template) {
        PatternTemplate previous = templates.put(template.name(), template);
        if (previous != null) {
            log.info("Replaced template: {}", template.name());
        }
        return this;
    }

    public Optional<PatternTemplate> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(templates.get(name));
    }

    public List<String> names() {
        return templates.keySet().stream().sorted().toList();
    }
}
