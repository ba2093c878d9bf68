package com.example.storelab.models;

/**
 * Users sharing one status. {@code avgAge} is null when no user in the group has an age.
 */
public record UserStats(UserStatus status, long count, Double avgAge) {
}
