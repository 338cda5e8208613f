package com.herzen.practice.session;

/**
 * Receives state changes from a {@link SessionStore}. Called on the thread that made the change,
 * in the order the changes happened.
 */
@FunctionalInterface
public interface SessionEventListener {

    void onEvent(SessionEvent event);
}
