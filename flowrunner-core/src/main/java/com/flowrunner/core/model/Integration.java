package com.flowrunner.core.model;

/**
 * An external service that exposes triggers and actions.
 * parentKey, when set, selects the definition that implements this integration.
 */
public record Integration(
    String id,
    String key,
    String parentKey,
    String name
) {
    public String definitionKey() {
        return parentKey != null ? parentKey : key;
    }
}
