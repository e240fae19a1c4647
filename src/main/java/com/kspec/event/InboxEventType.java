package com.kspec.event;

/** Inbox mutations that are pushed on {@code inbox:updates}. */
public enum InboxEventType {
    ITEM_CREATED("inbox_item_created"),
    ITEM_DELETED("inbox_item_deleted");

    private final String eventName;

    InboxEventType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
