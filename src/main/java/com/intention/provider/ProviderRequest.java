package com.intention.provider;

import com.intention.model.Message;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider-neutral request handed to a {@link ProviderAdapter}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProviderRequest {

    private String model;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    /**
     * Model parameters copied into the provider body as-is (temperature, max_tokens...).
     */
    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();

    /**
     * Copy of this request with extra messages appended; used for repair re-asks.
     */
    public ProviderRequest withAppended(Message... extra) {
        List<Message> combined = new ArrayList<>(messages);
        combined.addAll(List.of(extra));
        return toBuilder().messages(combined).build();
    }
}
