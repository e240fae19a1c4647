package com.kspec.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

/**
 * Micrometer meters for the event socket.
 *
 * <ul>
 *   <li><b>ws.connections.active</b> (gauge): registered connections</li>
 *   <li><b>ws.broadcast.delivered</b> (counter): per-connection event sends</li>
 *   <li><b>ws.broadcast.dropped</b> (counter): per-connection sends skipped for backpressure</li>
 *   <li><b>ws.evictions</b> (counter): connections the server closed as unresponsive (missed pong or stuck write)</li>
 *   <li><b>ws.commands.failed</b> (counter): commands answered with a failed ack</li>
 * </ul>
 *
 * <p>The connection gauge reads an internal counter that the registry keeps in step with its map, so the
 * meter has no back-reference to the registry.
 */
@Component
public class WebSocketMetrics {

    private final AtomicInteger activeConnections = new AtomicInteger();
    private final Counter deliveredCounter;
    private final Counter droppedCounter;
    private final Counter evictionCounter;
    private final Counter failedCommandCounter;

    public WebSocketMetrics(MeterRegistry meterRegistry) {
        Gauge.builder("ws.connections.active", activeConnections, AtomicInteger::get)
                .description("Currently registered WebSocket connections")
                .register(meterRegistry);

        this.deliveredCounter = Counter.builder("ws.broadcast.delivered")
                .description("Broadcast events queued for a connection")
                .register(meterRegistry);

        this.droppedCounter = Counter.builder("ws.broadcast.dropped")
                .description("Broadcast events skipped for a saturated connection")
                .register(meterRegistry);

        this.evictionCounter = Counter.builder("ws.evictions")
                .description("Connections closed by the server as unresponsive")
                .register(meterRegistry);

        this.failedCommandCounter = Counter.builder("ws.commands.failed")
                .description("Client commands answered with success=false")
                .register(meterRegistry);
    }

    public void connectionOpened() {
        activeConnections.incrementAndGet();
    }

    public void connectionClosed() {
        activeConnections.decrementAndGet();
    }

    public void recordDelivered(int count) {
        if (count > 0) {
            deliveredCounter.increment(count);
        }
    }

    public void recordDropped(int count) {
        if (count > 0) {
            droppedCounter.increment(count);
        }
    }

    public void recordEviction() {
        evictionCounter.increment();
    }

    public void recordFailedCommand() {
        failedCommandCounter.increment();
    }
}
