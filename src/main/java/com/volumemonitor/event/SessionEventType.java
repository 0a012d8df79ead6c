package com.volumemonitor.event;

public enum SessionEventType {
    /** A new session was created through the OAuth callback. */
    LOGGED_IN,
    /** A persisted session was reused on startup. */
    RESTORED,
    LOGGED_OUT
}
