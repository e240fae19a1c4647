package com.kspec.client;

import java.time.Duration;

/**
 * Serial executor the connection manager runs on. Tasks, including delayed ones, must never run
 * concurrently with each other, so the manager's state needs no locking.
 */
public interface ClientScheduler {

    void execute(Runnable task);

    Cancellable schedule(Runnable task, Duration delay);

    /** Handle of a delayed task. Cancelling a task that already ran is a no-op. */
    interface Cancellable {
        void cancel();
    }
}
