package com.incoresoft.presenceTracker.domain.matching.dto;

/**
 * Best match for one observed vector. {@code identityName} is null when the store is empty.
 */
public record MatchResult(String identityName, double similarity) {

    public static final MatchResult NO_MATCH = new MatchResult(null, 0);

    public boolean hasCandidate() {
        return identityName != null;
    }
}
