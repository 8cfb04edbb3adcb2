package com.incoresoft.presenceTracker.domain.identity.dto;

import java.time.Instant;
import java.util.Arrays;

/**
 * A registered person. Immutable; re-registration creates a new instance.
 */
public record Identity(String name, double[] featureVector, Instant registeredAt) {

    public Identity {
        featureVector = featureVector.clone();
    }

    @Override
    public double[] featureVector() {
        return featureVector.clone();
    }

    public IdentitySummary summary() {
        return new IdentitySummary(name, registeredAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Identity other)) return false;
        return name.equals(other.name)
                && Arrays.equals(featureVector, other.featureVector)
                && registeredAt.equals(other.registeredAt);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * name.hashCode() + Arrays.hashCode(featureVector)) + registeredAt.hashCode();
    }

    @Override
    public String toString() {
        return "Identity[name=" + name + ", dim=" + featureVector.length + ", registeredAt=" + registeredAt + "]";
    }
}
