package com.kspec.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published by the inbox routes after an item was added or removed.
 */
public class InboxEvent extends ApplicationEvent {

    private final InboxEventType eventType;
    private final String ref;
    private final String ulid;
    private final String projectPath;

    public InboxEvent(Object source, InboxEventType eventType, String ref, String ulid, String projectPath) {
        super(source);
        this.eventType = eventType;
        this.ref = ref;
        this.ulid = ulid;
        this.projectPath = projectPath;
    }

    public InboxEventType getEventType() {
        return eventType;
    }

    /** Reference the client used; null for newly created items. */
    public String getRef() {
        return ref;
    }

    public String getUlid() {
        return ulid;
    }

    public String getProjectPath() {
        return projectPath;
    }
}
