package de.t14d3.clientdb.event;

@FunctionalInterface
public interface ObjListener {
    void onEvent(ObjEvent event);
}
