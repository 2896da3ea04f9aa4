package com.flowrunner.core.model;

/**
 * Authentication account type shared by an integration's credentials.
 */
public record IntegrationAccount(
    String id,
    String key,
    String name
) {}
