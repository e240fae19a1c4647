package com.kspec.support;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Executor that parks tasks until {@link #runAll()}, modelling a socket whose writes have stalled.
 */
public class HoldingExecutor implements Executor {

    private final List<Runnable> pending = new ArrayList<>();

    @Override
    public synchronized void execute(Runnable command) {
        pending.add(command);
    }

    public void runAll() {
        List<Runnable> batch;
        synchronized (this) {
            batch = new ArrayList<>(pending);
            pending.clear();
        }
        batch.forEach(Runnable::run);
    }

    public synchronized int pendingCount() {
        return pending.size();
    }
}
