package com.flowrunner.engine.expression;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Everything an expression can see: the output bag and the built-in functions.
 */
public record ExpressionContext(
    Map<String, JsonNode> outputs,
    ExpressionFunctions functions
) {}
