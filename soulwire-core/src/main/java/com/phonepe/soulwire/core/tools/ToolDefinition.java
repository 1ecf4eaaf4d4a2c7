package com.phonepe.soulwire.core.tools;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * What the model is told about a tool
 */
@Value
@Builder
@Jacksonized
public class ToolDefinition {
    @NonNull
    String name;

    String description;

    /**
     * JSON schema of the arguments object
     */
    JsonNode parameters;
}
