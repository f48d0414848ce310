package de.t14d3.clientdb.event;

import de.t14d3.clientdb.config.CollectionRelation;

import java.util.List;
import java.util.Objects;

/**
 * Bus listener applying the declared collection relations: an invalidation of a dependency
 * schedules a full reset of every collection cascading from it.
 */
public final class CascadeInvalidator implements ObjListener {
    private final List<CollectionRelation> relations;
    private final InvalidationQueue queue;

    public CascadeInvalidator(List<CollectionRelation> relations, InvalidationQueue queue) {
        this.relations = List.copyOf(relations);
        this.queue = Objects.requireNonNull(queue, "queue");
    }

    @Override
    public void onEvent(ObjEvent event) {
        if (!event.type().cascades() || event.collection().isEmpty()) {
            return;
        }
        for (CollectionRelation relation : relations) {
            if (relation.cascadeAll() && relation.depCollection().equals(event.collection())) {
                queue.enqueue(relation.collection());
            }
        }
    }

    @Override
    public String toString() {
        return "CascadeInvalidator" + relations;
    }
}
