package com.kspec.protocol;

/**
 * Topic names the daemon publishes on. Clients may subscribe to any string; these are the ones the
 * daemon itself produces.
 */
public final class Topics {

    public static final String TASKS_UPDATES = "tasks:updates";
    public static final String INBOX_UPDATES = "inbox:updates";
    public static final String FILES_UPDATES = "files:updates";
    public static final String FILES_ERRORS = "files:errors";

    private Topics() {}
}
