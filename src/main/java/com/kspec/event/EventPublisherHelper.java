package com.kspec.event;

import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over {@link ApplicationEventPublisher} for the daemon's domain events.
 *
 * <p>Route handlers call these after a write has been persisted. Delivery to socket clients happens
 * asynchronously in {@link com.kspec.api.websocket.UpdatesRelay}, so publishing never blocks on the
 * network.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Task ----

    public void publishTaskCreated(Object source, String ref, String ulid, String projectPath) {
        applicationEventPublisher.publishEvent(new TaskEvent(source, TaskEventType.CREATED, ref, ulid, projectPath));
    }

    public void publishTaskUpdated(
            Object source, String ref, String ulid, String action, Map<String, Object> details, String projectPath) {
        applicationEventPublisher.publishEvent(
                new TaskEvent(source, TaskEventType.UPDATED, ref, ulid, action, details, projectPath));
    }

    public void publishTaskDeleted(Object source, String ref, String ulid, String projectPath) {
        applicationEventPublisher.publishEvent(new TaskEvent(source, TaskEventType.DELETED, ref, ulid, projectPath));
    }

    // ---- Inbox ----

    public void publishInboxItemCreated(Object source, String ulid, String projectPath) {
        applicationEventPublisher.publishEvent(
                new InboxEvent(source, InboxEventType.ITEM_CREATED, null, ulid, projectPath));
    }

    public void publishInboxItemDeleted(Object source, String ref, String ulid, String projectPath) {
        applicationEventPublisher.publishEvent(
                new InboxEvent(source, InboxEventType.ITEM_DELETED, ref, ulid, projectPath));
    }

    // ---- Files ----

    public void publishFileChanged(Object source, String ref, String projectPath) {
        applicationEventPublisher.publishEvent(new FileChangeEvent(source, ref, "modified", projectPath));
    }

    public void publishFileError(Object source, String ref, String error, String projectPath) {
        applicationEventPublisher.publishEvent(new FileErrorEvent(source, ref, error, projectPath));
    }
}
