package com.flowrunner.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Enrichment applied to each new trigger item: the action with key operationId
 * is invoked with the templated inputs, resolved against {inputs, outputs}.
 */
public record TriggerPopulate(
    String operationId,
    JsonNode inputs
) {}
