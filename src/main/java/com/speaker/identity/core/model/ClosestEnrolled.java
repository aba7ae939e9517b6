package com.speaker.identity.core.model;

import java.util.Objects;

/**
 * The enrolled speaker that was nearest to an unknown utterance, without being
 * close enough to match.
 */
public record ClosestEnrolled(String name, double similarity) {

    public ClosestEnrolled {
        Objects.requireNonNull(name, "name is required");
    }
}
