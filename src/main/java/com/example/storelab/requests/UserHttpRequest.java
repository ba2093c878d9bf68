package com.example.storelab.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * HTTP payload for creating or partially updating a user. On update, null fields mean
 * "leave unchanged". Status stays a raw string here so an unknown value is reported as a field
 * error rather than a parse failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserHttpRequest(
        @JsonProperty("name") String name,
        @JsonProperty("email") String email,
        @JsonProperty("age") Integer age,
        @JsonProperty("status") String status,
        @JsonProperty("metadata") Map<String, Object> metadata
) {}
