package com.questrail.gateway.transport;

import com.questrail.gateway.config.ListenerConfig;
import com.questrail.gateway.internal.time.WallClock;
import com.questrail.gateway.observability.GatewayErrorEvent;
import com.questrail.gateway.observability.GatewayObservabilitySink;
import com.questrail.gateway.observability.ListenerTransitionEvent;
import com.questrail.gateway.observability.NullObservabilitySink;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * ListenerManager
 * =============================================================================
 * Owns the network listeners of the broker and their tasks.
 *
 * <h2>Tasks</h2>
 * Every listener runs on its own thread ({@code mqtt-listener-<name>}), which
 * blocks in {@link NetworkListener#serve(Runnable)} until the listener ends.
 * A failing listener (bind failure, certificate load failure, unexpected
 * close) ends only its own task.
 *
 * <h2>Shutdown barrier</h2>
 * {@link #stop()} closes every listener and blocks until every task has
 * exited, regardless of whether a task ended by deliberate close or by
 * failure.
 *
 * <h2>Error channel</h2>
 * Terminal failures are handed to the error consumer supplied at
 * construction. The consumer runs on a dedicated reporter thread; a listener
 * task only enqueues, so reporting never blocks it. Each failure is delivered
 * exactly once. Failures are additionally reported to the observability sink.
 */
public final class ListenerManager
{
    private static final long REPORTER_DRAIN_SECONDS = 5;

    private final List<Managed> listeners;
    private final Consumer<ListenerFailure> errorConsumer;
    private final GatewayObservabilitySink observabilitySink;
    private final WallClock clock;

    private final ExecutorService reporter;
    private final CountDownLatch allStopped;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    /**
     * @param listeners         listeners to manage; names must be unique
     * @param errorConsumer     receives terminal listener failures; may be {@code null}
     * @param observabilitySink receives transitions and errors; may be {@code null}
     * @param clock             timestamp source for events
     */
    public ListenerManager(List<NetworkListener> listeners,
                           Consumer<ListenerFailure> errorConsumer,
                           GatewayObservabilitySink observabilitySink,
                           WallClock clock)
    {
        Objects.requireNonNull(listeners, "listeners");
        this.errorConsumer = errorConsumer;
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");

        List<Managed> managed = new ArrayList<>();
        Map<String, NetworkListener> byName = new LinkedHashMap<>();
        for (NetworkListener l : listeners) {
            String name = l.config().name();
            if (byName.putIfAbsent(name, l) != null) {
                throw new IllegalArgumentException("Duplicate listener name: " + name);
            }
            managed.add(new Managed(l));
        }
        this.listeners = Collections.unmodifiableList(managed);

        this.allStopped = new CountDownLatch(this.listeners.size());
        this.reporter = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "mqtt-listener-errors");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Spawns one task per listener and returns immediately. Listeners may not
     * yet accept connections when this method returns.
     *
     * @throws IllegalStateException if already started
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Listener manager already started");
        }
        for (Managed m : listeners) {
            m.transition(ListenerState.CREATED, ListenerState.STARTING);
            Thread t = new Thread(() -> runTask(m), "mqtt-listener-" + m.name());
            t.setDaemon(true);
            t.start();
        }
    }

    /**
     * Closes every listener and blocks until all listener tasks have exited.
     * Pending error reports are delivered before this method returns. Calls
     * after the first are no-ops.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        for (Managed m : listeners) {
            m.requestStop();
        }
        if (started.get()) {
            boolean interrupted = false;
            while (true) {
                try {
                    allStopped.await();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        reporter.shutdown();
        try {
            if (!reporter.awaitTermination(REPORTER_DRAIN_SECONDS, TimeUnit.SECONDS)) {
                reporter.shutdownNow();
            }
        } catch (InterruptedException e) {
            reporter.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public ListenerState state(String name) {
        return find(name).state.get();
    }

    /**
     * Snapshot of all listener states, in configuration order.
     */
    public Map<String, ListenerState> states() {
        Map<String, ListenerState> result = new LinkedHashMap<>();
        for (Managed m : listeners) {
            result.put(m.name(), m.state.get());
        }
        return Collections.unmodifiableMap(result);
    }

    public Optional<InetSocketAddress> boundAddress(String name) {
        return find(name).listener.boundAddress();
    }

    // -------------------------------------------------------------------------
    // Listener task
    // -------------------------------------------------------------------------

    private void runTask(Managed m) {
        try {
            m.listener.serve(() -> m.transition(ListenerState.STARTING, ListenerState.RUNNING));
            m.finish(ListenerState.STOPPED);
        } catch (ListenerException e) {
            m.finish(m.stopRequested.get() ? ListenerState.STOPPED : ListenerState.FAILED);
            report(m, e);
        } catch (RuntimeException e) {
            m.finish(m.stopRequested.get() ? ListenerState.STOPPED : ListenerState.FAILED);
            report(m, new ListenerException("Running " + m.name() + " listener failed: " + e.getMessage(), e));
        } finally {
            allStopped.countDown();
        }
    }

    private void report(Managed m, ListenerException cause) {
        ListenerConfig config = m.listener.config();
        ListenerFailure failure = new ListenerFailure(clock.now(), config.name(), config.kind(), cause);

        observabilitySink.onError(new GatewayErrorEvent(
                failure.timestamp(),
                "Running " + config.kind() + " listener " + config.name() + " failed: " + cause.getMessage(),
                cause));

        Consumer<ListenerFailure> consumer = errorConsumer;
        if (consumer == null) {
            return;
        }
        reporter.execute(() -> {
            try {
                consumer.accept(failure);
            } catch (RuntimeException e) {
                observabilitySink.onError(new GatewayErrorEvent(clock.now(), "Listener error consumer failed", e));
            }
        });
    }

    private Managed find(String name) {
        for (Managed m : listeners) {
            if (m.name().equals(name)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown listener: " + name);
    }

    /**
     * A listener plus its state machine.
     */
    private final class Managed
    {
        private final NetworkListener listener;
        private final AtomicReference<ListenerState> state = new AtomicReference<>(ListenerState.CREATED);
        private final AtomicBoolean stopRequested = new AtomicBoolean(false);

        Managed(NetworkListener listener) {
            this.listener = listener;
        }

        String name() {
            return listener.config().name();
        }

        void transition(ListenerState from, ListenerState to) {
            if (state.compareAndSet(from, to)) {
                emit(from, to);
            }
        }

        void requestStop() {
            stopRequested.set(true);
            ListenerState current = state.get();
            while (current == ListenerState.STARTING || current == ListenerState.RUNNING) {
                if (state.compareAndSet(current, ListenerState.STOPPING)) {
                    emit(current, ListenerState.STOPPING);
                    break;
                }
                current = state.get();
            }
            listener.close();
        }

        void finish(ListenerState terminal) {
            ListenerState previous = state.getAndSet(terminal);
            if (previous != terminal) {
                emit(previous, terminal);
            }
        }

        private void emit(ListenerState from, ListenerState to) {
            ListenerConfig config = listener.config();
            observabilitySink.onListenerTransition(new ListenerTransitionEvent(
                    clock.now(),
                    config.name(),
                    config.kind(),
                    config.bindAddressText(),
                    from,
                    to));
        }
    }
}
