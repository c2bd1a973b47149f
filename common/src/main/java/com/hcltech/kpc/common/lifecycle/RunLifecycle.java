package com.hcltech.kpc.common.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;

/**
 * NOT_STARTED -> RUNNING -> STOPPED guard for a component with a start and a stop action.
 * <ul>
 *   <li>{@link #start(Runnable)} runs its action at most once, and never after stop.</li>
 *   <li>{@link #stop(Runnable)} runs its action at most once, outside the lock, so
 *       {@link #state()} stays readable while it runs. A concurrent second caller blocks
 *       until the first caller's action has finished.</li>
 *   <li>Stopping a component that never started still runs the action, so resources handed
 *       to the component are released either way.</li>
 * </ul>
 */
public final class RunLifecycle {
    private static final Logger log = LoggerFactory.getLogger(RunLifecycle.class);

    private final String name;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile LifecycleState state = LifecycleState.NOT_STARTED;

    public RunLifecycle(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * @throws IllegalStateException if already started or already stopped
     */
    public synchronized void start(Runnable action) {
        Objects.requireNonNull(action, "action");
        switch (state) {
            case RUNNING -> throw new IllegalStateException(name + " already started");
            case STOPPED -> throw new IllegalStateException(name + " already stopped");
            default -> {
            }
        }
        action.run();
        state = LifecycleState.RUNNING;
        log.debug("{} started", name);
    }

    /** @return true if this call ran the stop action. */
    public boolean stop(Runnable action) {
        Objects.requireNonNull(action, "action");
        boolean first;
        synchronized (this) {
            first = state != LifecycleState.STOPPED;
            state = LifecycleState.STOPPED;
        }
        if (!first) {
            awaitStopped();
            return false;
        }
        try {
            action.run();
            log.debug("{} stopped", name);
        } finally {
            stopped.countDown();
        }
        return true;
    }

    private void awaitStopped() {
        boolean interrupted = false;
        while (true) {
            try {
                stopped.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
    }

    public LifecycleState state() {
        return state;
    }

    public String name() {
        return name;
    }
}
