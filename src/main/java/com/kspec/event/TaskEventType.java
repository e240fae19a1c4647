package com.kspec.event;

/** Task mutations that are pushed on {@code tasks:updates}. */
public enum TaskEventType {
    CREATED("task_created"),
    UPDATED("task_updated"),
    DELETED("task_deleted");

    private final String eventName;

    TaskEventType(String eventName) {
        this.eventName = eventName;
    }

    /** Value of the broadcast's {@code event} field. */
    public String getEventName() {
        return eventName;
    }
}
