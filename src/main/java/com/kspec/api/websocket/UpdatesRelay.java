package com.kspec.api.websocket;

import com.kspec.event.FileChangeEvent;
import com.kspec.event.FileErrorEvent;
import com.kspec.event.InboxEvent;
import com.kspec.event.TaskEvent;
import com.kspec.protocol.Topics;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Turns domain events into topic broadcasts:
 * <ul>
 *   <li>{@link TaskEvent} to {@code tasks:updates}</li>
 *   <li>{@link InboxEvent} to {@code inbox:updates}</li>
 *   <li>{@link FileChangeEvent} to {@code files:updates}</li>
 *   <li>{@link FileErrorEvent} to {@code files:errors}</li>
 * </ul>
 *
 * <p>All handlers run async on the eventExecutor so a route handler's response never waits on socket
 * fan-out. A failed broadcast is logged and not reported back to the publisher, whose write has
 * already succeeded.
 */
@Component
public class UpdatesRelay {

    private static final Logger log = LoggerFactory.getLogger(UpdatesRelay.class);

    private final TopicRegistry topicRegistry;

    public UpdatesRelay(TopicRegistry topicRegistry) {
        this.topicRegistry = topicRegistry;
    }

    @Async("eventExecutor")
    @EventListener
    public void onTaskEvent(TaskEvent taskEvent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ref", taskEvent.getRef());
        payload.put("ulid", taskEvent.getUlid());
        if (taskEvent.getAction() != null) {
            payload.put("action", taskEvent.getAction());
        }
        payload.putAll(taskEvent.getDetails());

        sendUpdate(
                Topics.TASKS_UPDATES,
                taskEvent.getEventType().getEventName(),
                payload,
                taskEvent.getProjectPath());
    }

    @Async("eventExecutor")
    @EventListener
    public void onInboxEvent(InboxEvent inboxEvent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (inboxEvent.getRef() != null) {
            payload.put("ref", inboxEvent.getRef());
        }
        payload.put("ulid", inboxEvent.getUlid());

        sendUpdate(
                Topics.INBOX_UPDATES,
                inboxEvent.getEventType().getEventName(),
                payload,
                inboxEvent.getProjectPath());
    }

    @Async("eventExecutor")
    @EventListener
    public void onFileChangeEvent(FileChangeEvent fileChangeEvent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ref", fileChangeEvent.getRef());
        payload.put("action", fileChangeEvent.getAction());

        sendUpdate(Topics.FILES_UPDATES, FileChangeEvent.EVENT_NAME, payload, fileChangeEvent.getProjectPath());
    }

    @Async("eventExecutor")
    @EventListener
    public void onFileErrorEvent(FileErrorEvent fileErrorEvent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ref", fileErrorEvent.getRef());
        payload.put("error", fileErrorEvent.getError());

        sendUpdate(Topics.FILES_ERRORS, FileErrorEvent.EVENT_NAME, payload, fileErrorEvent.getProjectPath());
    }

    private void sendUpdate(String topic, String event, Map<String, Object> payload, String projectPath) {
        try {
            BroadcastResult result = topicRegistry.broadcast(topic, event, payload, projectPath);
            log.debug("Relayed {} as {}: {}", event, result.getMsgId(), result);
        } catch (Exception e) {
            log.error("Failed to relay {} on {}: {}", event, topic, e.getMessage(), e);
        }
    }
}
