package com.intention.template;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Metadata for template registration and management.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateMetadata {

    private String name;

    private String description;

    @Builder.Default
    private String version = "1.0.0";

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    /**
     * Fingerprint namespace, {@code name@version}.
     */
    public String getNamespace() {
        return name + "@" + version;
    }
}
