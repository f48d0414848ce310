package de.t14d3.clientdb.config;

import java.util.Objects;

/**
 * Declares that cached rows of {@code collection} depend on {@code depCollection}.
 *
 * With {@code cascadeAll}, an invalidation of {@code depCollection} resets all of {@code collection}.
 */
public record CollectionRelation(String collection, String depCollection, boolean cascadeAll) {

    public CollectionRelation {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(depCollection, "depCollection");
    }
}
