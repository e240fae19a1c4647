package com.kspec.event;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the task routes after a mutation has been persisted.
 *
 * <p>{@code action} names the operation within an update (for example "start", "complete", "note_added")
 * and {@code details} carries operation-specific fields such as the new status or a note ULID. Both end up
 * in the broadcast payload next to {@code ref} and {@code ulid}.
 */
public class TaskEvent extends ApplicationEvent {

    private final TaskEventType eventType;
    private final String ref;
    private final String ulid;
    private final String action;
    private final Map<String, Object> details;
    private final String projectPath;

    public TaskEvent(Object source, TaskEventType eventType, String ref, String ulid, String projectPath) {
        this(source, eventType, ref, ulid, null, null, projectPath);
    }

    public TaskEvent(
            Object source,
            TaskEventType eventType,
            String ref,
            String ulid,
            String action,
            Map<String, Object> details,
            String projectPath) {
        super(source);
        this.eventType = eventType;
        this.ref = ref;
        this.ulid = ulid;
        this.action = action;
        this.details = details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>();
        this.projectPath = projectPath;
    }

    public TaskEventType getEventType() {
        return eventType;
    }

    public String getRef() {
        return ref;
    }

    public String getUlid() {
        return ulid;
    }

    public String getAction() {
        return action;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    /** Project the task belongs to; null broadcasts to every project's clients. */
    public String getProjectPath() {
        return projectPath;
    }
}
