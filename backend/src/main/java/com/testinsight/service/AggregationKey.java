package com.testinsight.service;

import java.util.Collection;
import java.util.UUID;

/**
 * The (window, repository) pair a cached overview is stored under.
 */
public record AggregationKey(int windowDays, UUID repositoryId) {

    public static final String ALL_REPOSITORIES = "all";

    public static AggregationKey of(int windowDays, UUID repositoryId, Collection<Integer> allowedWindows) {
        if (!allowedWindows.contains(windowDays)) {
            throw new IllegalArgumentException("Unsupported window: " + windowDays + " days (allowed: " + allowedWindows + ")");
        }
        return new AggregationKey(windowDays, repositoryId);
    }

    public String scopeKey() {
        return repositoryId != null ? repositoryId.toString() : ALL_REPOSITORIES;
    }
}
