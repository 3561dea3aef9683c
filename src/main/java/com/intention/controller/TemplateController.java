package com.intention.controller;

import com.intention.template.PromptTemplate;
import com.intention.template.TemplateRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists registered templates.
 */
@RestController
@RequestMapping("/v1/templates")
public class TemplateController {

    private final TemplateRegistry registry;

    public TemplateController(TemplateRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listTemplates() {
        List<Map<String, Object>> templates = new ArrayList<>();
        for (String name : registry.list()) {
            PromptTemplate template = registry.get(name);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", name);
            entry.put("version", template.getMetadata().getVersion());
            entry.put("description", template.getMetadata().getDescription());
            entry.put("input", template.getInputSchema());
            entry.put("output", template.getOutputSchema().getFields());
            templates.add(entry);
        }
        return ResponseEntity.ok(templates);
    }
}
