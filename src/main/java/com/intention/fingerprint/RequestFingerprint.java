package com.intention.fingerprint;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Deterministic identity of a logical request, used as the cache and single-flight key.
 *
 * <p>Rendered as {@code provider:namespace:digest} so that prefix invalidation can target
 * every entry of a provider ({@code "openai:"}) or of one template version
 * ({@code "openai:product_search@1.0.0:"}).</p>
 */
@Getter
@EqualsAndHashCode
public final class RequestFingerprint {

    public static final String SEPARATOR = ":";
    public static final String DEFAULT_NAMESPACE = "default";

    private final String providerId;
    private final String namespace;
    private final String digest;

    public RequestFingerprint(String providerId, String namespace, String digest) {
        if (providerId == null || providerId.isBlank() || providerId.contains(SEPARATOR)) {
            throw new IllegalArgumentException("Invalid provider id: " + providerId);
        }
        if (namespace == null || namespace.isBlank() || namespace.contains(SEPARATOR)) {
            throw new IllegalArgumentException("Invalid namespace: " + namespace);
        }
        if (digest == null || digest.isBlank()) {
            throw new IllegalArgumentException("Digest must not be blank");
        }
        this.providerId = providerId;
        this.namespace = namespace;
        this.digest = digest;
    }

    /**
     * Parse a value previously produced by {@link #getValue()}.
     */
    public static RequestFingerprint parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Fingerprint must not be null");
        }
        String[] parts = value.split(SEPARATOR, -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Malformed fingerprint: " + value);
        }
        return new RequestFingerprint(parts[0], parts[1], parts[2]);
    }

    /**
     * Prefix selecting every entry for a provider.
     */
    public static String providerPrefix(String providerId) {
        return providerId + SEPARATOR;
    }

    /**
     * Prefix selecting every entry for one namespace (template version) of a provider.
     */
    public static String namespacePrefix(String providerId, String namespace) {
        return providerId + SEPARATOR + namespace + SEPARATOR;
    }

    public String getValue() {
        return providerId + SEPARATOR + namespace + SEPARATOR + digest;
    }

    public boolean hasPrefix(String prefix) {
        return getValue().startsWith(prefix);
    }

    @Override
    public String toString() {
        return getValue();
    }
}
