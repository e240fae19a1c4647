package com.kspec.unit.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.kspec.api.websocket.BroadcastResult;
import com.kspec.api.websocket.ConnectionState;
import com.kspec.api.websocket.SocketConnection;
import com.kspec.api.websocket.TopicRegistry;
import com.kspec.config.AsyncConfig;
import com.kspec.config.DaemonProperties;
import com.kspec.exception.ConnectionRegistryException;
import com.kspec.exception.ErrorCode;
import com.kspec.observability.WebSocketMetrics;
import com.kspec.protocol.Topics;
import com.kspec.support.HoldingExecutor;
import com.kspec.support.RecordingSocket;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.socket.CloseStatus;

class TopicRegistryTest {

    private static final Executor DIRECT = Runnable::run;

    private SimpleMeterRegistry meterRegistry;
    private TopicRegistry topicRegistry;

    @BeforeEach
    void setUp() {
        topicRegistry = newRegistry(1024 * 1024);
    }

    private TopicRegistry newRegistry(long thresholdBytes) {
        meterRegistry = new SimpleMeterRegistry();
        DaemonProperties properties = new DaemonProperties();
        properties.getWebsocket().setBackpressureThresholdBytes(thresholdBytes);
        return new TopicRegistry(RecordingSocket.CODEC, new WebSocketMetrics(meterRegistry), properties);
    }

    private SocketConnection register(String sessionId, RecordingSocket socket, String projectPath, Executor executor) {
        SocketConnection connection =
                new SocketConnection(sessionId, socket.session(), projectPath, Instant.now(), executor);
        topicRegistry.addConnection(connection);
        connection.markOpen();
        return connection;
    }

    private SocketConnection register(String sessionId, RecordingSocket socket) {
        return register(sessionId, socket, null, DIRECT);
    }

    @Nested
    @DisplayName("Broadcast sequencing")
    class Sequencing {

        @Test
        @DisplayName("assigns per-connection seq starting at 0 and shares msg_id across recipients")
        void perConnectionSequence() {
            RecordingSocket socketA = new RecordingSocket();
            RecordingSocket socketB = new RecordingSocket();
            register("A", socketA);
            register("B", socketB);
            topicRegistry.subscribe("A", List.of(Topics.TASKS_UPDATES));
            topicRegistry.subscribe("B", List.of(Topics.TASKS_UPDATES, Topics.INBOX_UPDATES));

            BroadcastResult first = topicRegistry.broadcast(Topics.TASKS_UPDATES, "task_updated", Map.of("ref", "@t1"));
            BroadcastResult second =
                    topicRegistry.broadcast(Topics.INBOX_UPDATES, "inbox_item_created", Map.of("ulid", "01J"));

            assertThat(first.getDelivered()).isEqualTo(2);
            assertThat(second.getDelivered()).isEqualTo(1);

            List<Map<String, Object>> eventsA = socketA.broadcasts();
            List<Map<String, Object>> eventsB = socketB.broadcasts();
            assertThat(eventsA).hasSize(1);
            assertThat(eventsA.get(0)).containsEntry("seq", 0).containsEntry("topic", Topics.TASKS_UPDATES);
            assertThat(eventsB).hasSize(2);
            assertThat(eventsB.get(0)).containsEntry("seq", 0);
            assertThat(eventsB.get(1)).containsEntry("seq", 1).containsEntry("event", "inbox_item_created");

            assertThat(eventsA.get(0).get("msg_id")).isEqualTo(eventsB.get(0).get("msg_id"));
            assertThat(eventsA.get(0).get("msg_id")).isEqualTo(first.getMsgId());
            assertThat(eventsA.get(0).get("timestamp")).isEqualTo(eventsB.get(0).get("timestamp"));
        }

        @Test
        @DisplayName("msg_id is a fresh ULID per logical event")
        void distinctMessageIds() {
            register("A", new RecordingSocket());
            topicRegistry.subscribe("A", List.of(Topics.TASKS_UPDATES));

            String first = topicRegistry.broadcast(Topics.TASKS_UPDATES, "task_updated", Map.of()).getMsgId();
            String second = topicRegistry.broadcast(Topics.TASKS_UPDATES, "task_updated", Map.of()).getMsgId();

            assertThat(first).hasSize(26).isNotEqualTo(second);
            assertThat(second.compareTo(first)).isPositive();
        }

        @Test
        @DisplayName("seq stays strictly increasing across many events")
        void monotonicSequence() {
            RecordingSocket socket = new RecordingSocket();
            SocketConnection connection = register("A", socket);
            topicRegistry.subscribe("A", List.of(Topics.FILES_UPDATES));

            for (int i = 0; i < 5; i++) {
                topicRegistry.broadcast(Topics.FILES_UPDATES, "file_changed", Map.of("i", i));
            }

            assertThat(socket.broadcasts()).extracting(frame -> frame.get("seq")).containsExactly(0, 1, 2, 3, 4);
            assertThat(connection.getOutSeq()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("Topic filtering")
    class TopicFiltering {

        @Test
        @DisplayName("connection without the topic receives nothing and keeps its seq")
        void unsubscribedConnectionSkipped() {
            RecordingSocket socket = new RecordingSocket();
            SocketConnection connection = register("A", socket);
            topicRegistry.subscribe("A", List.of(Topics.INBOX_UPDATES));

            BroadcastResult result = topicRegistry.broadcast(Topics.TASKS_UPDATES, "task_updated", Map.of());

            assertThat(result.getDelivered()).isZero();
            assertThat(socket.textFrames()).isEmpty();
            assertThat(connection.getOutSeq()).isZero();
        }

        @Test
        @DisplayName("unsubscribe stops delivery of that topic only")
        void unsubscribeStopsDelivery() {
            RecordingSocket socket = new RecordingSocket();
            register("A", socket);
            topicRegistry.subscribe("A", List.of(Topics.TASKS_UPDATES, Topics.INBOX_UPDATES));

            assertThat(topicRegistry.unsubscribe("A", List.of(Topics.TASKS_UPDATES))).isTrue();
            topicRegistry.broadcast(Topics.TASKS_UPDATES, "task_updated", Map.of());
            topicRegistry.broadcast(Topics.INBOX_UPDATES, "inbox_item_created", Map.of());

            assertThat(socket.broadcasts()).singleElement().satisfies(frame -> {
                assertThat(frame).containsEntry("topic", Topics.INBOX_UPDATES);
                assertThat(frame).containsEntry("seq", 0);
            });
        }

        @Test
        @DisplayName("subscribe and unsubscribe report an unknown session")
        void unknownSession() {
            assertThat(topicRegistry.subscribe("missing", List.of(Topics.TASKS_UPDATES))).isFalse();
            assertThat(topicRegistry.unsubscribe("missing", List.of(Topics.TASKS_UPDATES))).isFalse();
        }

        @Test
        @DisplayName("project-scoped broadcast reaches only connections bound to that project")
        void projectScopedBroadcast() {
            RecordingSocket alpha = new RecordingSocket();
            RecordingSocket beta = new RecordingSocket();
            RecordingSocket unbound = new RecordingSocket();
            register("alpha", alpha, "/work/alpha", DIRECT);
            register("beta", beta, "/work/beta", DIRECT);
            register("unbound", unbound, null, DIRECT);
            for (String id : List.of("alpha", "beta", "unbound")) {
                topicRegistry.subscribe(id, List.of(Topics.FILES_UPDATES));
            }

            BroadcastResult scoped =
                    topicRegistry.broadcast(Topics.FILES_UPDATES, "file_changed", Map.of("ref", "a.yaml"), "/work/alpha");
            BroadcastResult global = topicRegistry.broadcast(Topics.FILES_UPDATES, "file_changed", Map.of());

            assertThat(scoped.getDelivered()).isEqualTo(1);
            assertThat(global.getDelivered()).isEqualTo(3);
            assertThat(alpha.broadcasts()).hasSize(2);
            assertThat(beta.broadcasts()).singleElement().satisfies(frame -> assertThat(frame).containsEntry("seq", 0));
            assertThat(unbound.broadcasts()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Backpressure")
    class Backpressure {

        @Test
        @DisplayName("saturated connection has the event skipped without consuming a seq")
        void dropsWithoutIncrementingSeq() {
            topicRegistry = newRegistry(64);
            HoldingExecutor stalled = new HoldingExecutor();
            RecordingSocket slow = new RecordingSocket();
            RecordingSocket fast = new RecordingSocket();
            SocketConnection slowConnection = register("slow", slow, null, stalled);
            register("fast", fast);
            topicRegistry.subscribe("slow", List.of(Topics.TASKS_UPDATES));
            topicRegistry.subscribe("fast", List.of(Topics.TASKS_UPDATES));

            BroadcastResult first = topicRegistry.broadcast(Topics.TASKS_UPDATES, "task_updated", Map.of("n", 1));
            assertThat(first.getDelivered()).isEqualTo(2);
            assertThat(slowConnection.getBufferedBytes()).isGreaterThanOrEqualTo(64);

            BroadcastResult second = topicRegistry.broadcast(Topics.TASKS_UPDATES, "task_updated", Map.of("n", 2));
            assertThat(second.getDelivered()).isEqualTo(1);
            assertThat(second.getDropped()).isEqualTo(1);
            assertThat(slowConnection.getOutSeq()).isEqualTo(1);

            stalled.runAll();
            assertThat(slowConnection.getBufferedBytes()).isZero();

            topicRegistry.broadcast(Topics.TASKS_UPDATES, "task_updated", Map.of("n", 3));
            stalled.runAll();

            assertThat(slow.broadcasts()).extracting(frame -> frame.get("seq")).containsExactly(0, 1);
            assertThat(fast.broadcasts()).extracting(frame -> frame.get("seq")).containsExactly(0, 1, 2);
            assertThat(meterRegistry.get("ws.broadcast.dropped").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("frames queued while stalled are written in order once the socket drains")
        void queuedFramesKeepOrder() {
            HoldingExecutor stalled = new HoldingExecutor();
            RecordingSocket socket = new RecordingSocket();
            register("A", socket, null, stalled);
            topicRegistry.subscribe("A", List.of(Topics.TASKS_UPDATES));

            for (int i = 0; i < 3; i++) {
                topicRegistry.broadcast(Topics.TASKS_UPDATES, "task_updated", Map.of("i", i));
            }
            assertThat(socket.textFrames()).isEmpty();
            assertThat(stalled.pendingCount()).isEqualTo(1);

            stalled.runAll();

            assertThat(socket.broadcasts()).extracting(frame -> frame.get("seq")).containsExactly(0, 1, 2);
        }
    }

    @Nested
    @DisplayName("Connection lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("duplicate session id is rejected")
        void duplicateSession() {
            register("A", new RecordingSocket());

            assertThatThrownBy(() -> register("A", new RecordingSocket()))
                    .isInstanceOf(ConnectionRegistryException.class)
                    .satisfies(e -> assertThat(((ConnectionRegistryException) e).getErrorCode())
                            .isEqualTo(ErrorCode.CONFLICT));
        }

        @Test
        @DisplayName("remove is idempotent and stops delivery")
        void removeIsIdempotent() {
            RecordingSocket socket = new RecordingSocket();
            SocketConnection connection = register("A", socket);
            topicRegistry.subscribe("A", List.of(Topics.TASKS_UPDATES));

            assertThat(topicRegistry.removeConnection("A")).contains(connection);
            assertThat(topicRegistry.removeConnection("A")).isEmpty();

            BroadcastResult result = topicRegistry.broadcast(Topics.TASKS_UPDATES, "task_updated", Map.of());
            assertThat(result.getDelivered()).isZero();
            assertThat(socket.textFrames()).isEmpty();
            assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSED);
            assertThat(topicRegistry.connectionCount()).isZero();
        }

        @Test
        @DisplayName("evict removes the connection and closes the socket with the given status")
        void evictClosesSocket() {
            RecordingSocket socket = new RecordingSocket();
            register("A", socket);

            assertThat(topicRegistry.evict("A", CloseStatus.GOING_AWAY)).isTrue();
            assertThat(topicRegistry.evict("A", CloseStatus.GOING_AWAY)).isFalse();

            assertThat(topicRegistry.find("A")).isEmpty();
            assertThat(socket.closeStatus().getCode()).isEqualTo(1001);
        }

        @Test
        @DisplayName("a connection whose socket rejects a write is evicted with 4500")
        void failedWriteEvicts() {
            RecordingSocket broken = new RecordingSocket();
            RecordingSocket healthy = new RecordingSocket();
            SocketConnection connection = register("A", broken);
            register("B", healthy);
            topicRegistry.subscribe("A", List.of(Topics.TASKS_UPDATES));
            topicRegistry.subscribe("B", List.of(Topics.TASKS_UPDATES));
            broken.failWritesWith(new IOException("Connection reset by peer"));

            topicRegistry.broadcast(Topics.TASKS_UPDATES, "task_updated", Map.of("ref", "01"));
            BroadcastResult next = topicRegistry.broadcast(Topics.TASKS_UPDATES, "task_updated", Map.of("ref", "02"));

            assertThat(topicRegistry.find("A")).isEmpty();
            assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSED);
            assertThat(broken.closeStatus().getCode()).isEqualTo(4500);
            assertThat(next.getDelivered()).isEqualTo(1);
            assertThat(healthy.broadcasts()).hasSize(2);
            assertThat(meterRegistry.get("ws.evictions").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("shutdown closes every connection with 1000 and refuses new ones")
        void shutdownClosesAll() {
            RecordingSocket first = new RecordingSocket();
            RecordingSocket second = new RecordingSocket();
            register("A", first);
            register("B", second);

            int closed = topicRegistry.shutdown(new CloseStatus(1000, "Server shutting down"));

            assertThat(closed).isEqualTo(2);
            assertThat(first.closeStatus().getCode()).isEqualTo(1000);
            assertThat(second.closeStatus().getReason()).isEqualTo("Server shutting down");
            assertThat(topicRegistry.connectionCount()).isZero();
            assertThat(topicRegistry.isClosed()).isTrue();
            assertThatThrownBy(() -> register("C", new RecordingSocket()))
                    .isInstanceOf(ConnectionRegistryException.class)
                    .hasMessageContaining("shutting down");
        }

        @Test
        @DisplayName("subscriptions snapshot maps sessions to their topics")
        void subscriptionsSnapshot() {
            register("A", new RecordingSocket());
            register("B", new RecordingSocket());
            topicRegistry.subscribe("A", List.of(Topics.TASKS_UPDATES, Topics.FILES_ERRORS));

            Map<String, Set<String>> snapshot = topicRegistry.subscriptionsSnapshot();

            assertThat(snapshot).containsOnlyKeys("A", "B");
            assertThat(snapshot.get("A")).containsExactlyInAnyOrder(Topics.TASKS_UPDATES, Topics.FILES_ERRORS);
            assertThat(snapshot.get("B")).isEmpty();
        }

        @Test
        @DisplayName("active connection gauge follows add and remove")
        void connectionGauge() {
            register("A", new RecordingSocket());
            register("B", new RecordingSocket());
            topicRegistry.removeConnection("A");

            assertThat(meterRegistry.get("ws.connections.active").gauge().value()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Concurrent delivery on the outbound pool")
    class Concurrency {

        private ThreadPoolTaskExecutor outboundExecutor;

        @BeforeEach
        void startPool() {
            topicRegistry = newRegistry(Long.MAX_VALUE);
            outboundExecutor = new AsyncConfig(new DaemonProperties()).outboundExecutor();
            outboundExecutor.initialize();
        }

        @AfterEach
        void stopPool() {
            outboundExecutor.shutdown();
        }

        private List<Thread> broadcasters(int threads, int perThread, CountDownLatch start) {
            List<Thread> result = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                result.add(new Thread(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < perThread; i++) {
                        topicRegistry.broadcast(Topics.TASKS_UPDATES, "task_updated", Map.of("thread", thread, "i", i));
                    }
                }));
            }
            result.forEach(Thread::start);
            return result;
        }

        private void joinAll(List<Thread> threads) throws InterruptedException {
            for (Thread thread : threads) {
                thread.join(TimeUnit.SECONDS.toMillis(30));
                assertThat(thread.isAlive()).isFalse();
            }
        }

        private List<Long> seqs(RecordingSocket socket) {
            return socket.broadcasts().stream()
                    .map(frame -> ((Number) frame.get("seq")).longValue())
                    .toList();
        }

        @Test
        @DisplayName("broadcasts from 8 threads reach one connection with seq 0..1999 in order")
        void concurrentBroadcastsKeepSeqOrder() throws Exception {
            RecordingSocket socket = new RecordingSocket();
            SocketConnection connection = register("A", socket, null, outboundExecutor);
            topicRegistry.subscribe("A", List.of(Topics.TASKS_UPDATES));
            CountDownLatch start = new CountDownLatch(1);

            List<Thread> threads = broadcasters(8, 250, start);
            start.countDown();
            joinAll(threads);

            assertThat(socket.awaitFrames(2000, Duration.ofSeconds(30))).isTrue();
            assertThat(seqs(socket)).containsExactlyElementsOf(
                    LongStream.range(0, 2000).boxed().toList());
            assertThat(connection.getOutSeq()).isEqualTo(2000);
        }

        @Test
        @DisplayName("nothing is delivered to a connection after removeConnection returns")
        void removalRacingBroadcasts() throws Exception {
            RecordingSocket removed = new RecordingSocket();
            RecordingSocket kept = new RecordingSocket();
            SocketConnection connection = register("A", removed, null, outboundExecutor);
            register("B", kept, null, outboundExecutor);
            topicRegistry.subscribe("A", List.of(Topics.TASKS_UPDATES));
            topicRegistry.subscribe("B", List.of(Topics.TASKS_UPDATES));
            CountDownLatch start = new CountDownLatch(1);

            List<Thread> threads = broadcasters(4, 500, start);
            start.countDown();
            assertThat(removed.awaitFrames(50, Duration.ofSeconds(30))).isTrue();
            topicRegistry.removeConnection("A");
            long seqAtRemoval = connection.getOutSeq();
            int framesAtRemoval = removed.frameCount();
            joinAll(threads);
            assertThat(kept.awaitFrames(2000, Duration.ofSeconds(30))).isTrue();
            outboundExecutor.shutdown();

            assertThat(connection.getOutSeq()).isEqualTo(seqAtRemoval);
            // one frame may already have been taken off the queue by a drain mid-write
            assertThat(removed.frameCount()).isBetween(framesAtRemoval, framesAtRemoval + 1);
            List<Long> delivered = seqs(removed);
            assertThat(delivered).isSorted().doesNotHaveDuplicates().allMatch(seq -> seq < seqAtRemoval);
            assertThat(seqs(kept)).containsExactlyElementsOf(
                    LongStream.range(0, 2000).boxed().toList());
        }
    }
}
