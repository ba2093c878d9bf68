package com.example.storelab.http;

import com.example.storelab.models.UserStats;
import com.example.storelab.models.UserStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

public record UserStatsResponse(
        @JsonProperty("status") UserStatus status,
        @JsonProperty("count") long count,
        @JsonProperty("avgAge") Double avgAge
) {
    public static UserStatsResponse from(UserStats stats) {
        return new UserStatsResponse(stats.status(), stats.count(), stats.avgAge());
    }
}
