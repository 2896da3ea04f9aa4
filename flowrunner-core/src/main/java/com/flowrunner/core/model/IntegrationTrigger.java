package com.flowrunner.core.model;

/**
 * A pollable operation offered by an integration.
 * idKey selects the field identifying each returned item, e.g. {@code items[].id}.
 */
public record IntegrationTrigger(
    String id,
    String integrationId,
    String key,
    String name,
    String idKey,
    TriggerPopulate triggerPopulate
) implements IntegrationOperation {

    public boolean hasIdKey() {
        return idKey != null && !idKey.isBlank();
    }

    public boolean hasPopulate() {
        return triggerPopulate != null && triggerPopulate.operationId() != null;
    }
}
