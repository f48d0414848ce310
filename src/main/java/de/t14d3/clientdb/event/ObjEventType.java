package de.t14d3.clientdb.event;

public enum ObjEventType {
    /** An object was written. */
    SET("set"),
    /** A cached object was transformed in place. */
    UPDATE("update"),
    /** An object was invalidated and should be fetched again from its data source. */
    RESET("reset"),
    /** Every object owned by or tagged with the collection was invalidated. */
    RESET_COLLECTION("resetCollection"),
    /** All objects were invalidated and should be fetched again. */
    RESET_ALL("resetAll"),
    /** An object was deleted from its data source. */
    DELETE("delete"),
    /** The cache was wiped; nothing needs to be fetched again. */
    CLEAR_ALL("clearAll");

    private final String wireName;

    ObjEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Whether an event of this type on a dependency collection resets the collections depending on it.
     */
    public boolean cascades() {
        return this == RESET || this == UPDATE || this == DELETE || this == RESET_COLLECTION;
    }

    public static ObjEventType fromWireName(String wireName) {
        for (ObjEventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + wireName);
    }
}
