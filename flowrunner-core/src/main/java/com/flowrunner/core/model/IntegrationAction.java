package com.flowrunner.core.model;

/**
 * An operation offered by an integration that workflow actions can invoke.
 */
public record IntegrationAction(
    String id,
    String integrationId,
    String key,
    String name
) implements IntegrationOperation {}
