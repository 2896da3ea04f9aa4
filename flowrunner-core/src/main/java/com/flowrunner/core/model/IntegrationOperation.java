package com.flowrunner.core.model;

/**
 * Common view of integration triggers and actions, as handed to the operation invoker.
 */
public interface IntegrationOperation {

    String id();

    String integrationId();

    String key();

    String name();
}
