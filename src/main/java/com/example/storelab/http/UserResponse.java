package com.example.storelab.http;

import com.example.storelab.models.User;
import com.example.storelab.models.UserStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserResponse(
        @JsonProperty("_id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("email") String email,
        @JsonProperty("age") Integer age,
        @JsonProperty("status") UserStatus status,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt
) {
    public static UserResponse from(User user) {
        return new UserResponse(
                user.getId(),
                user.getName(),
                user.getEmail(),
                user.getAge(),
                user.getStatus(),
                user.getMetadata(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
