package com.questrail.gateway.transport;

import com.questrail.gateway.config.ListenerConfig;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * FakeNetworkListener
 * -----------------------------------------------------------------------------
 * Test-only {@link NetworkListener} with scripted outcomes.
 *
 * <p>It opens no sockets. A listener either fails during preparation, or
 * "binds" and then serves until closed or until a test injects a fatal
 * transport failure.</p>
 */
public final class FakeNetworkListener implements NetworkListener {

    private final ListenerConfig config;
    private final ListenerException startupFailure;
    private final InetSocketAddress address;

    private final CountDownLatch released = new CountDownLatch(1);
    private final CountDownLatch bound = new CountDownLatch(1);
    private volatile ListenerException runtimeFailure;
    private volatile boolean closed;
    private volatile int closeCalls;

    private FakeNetworkListener(ListenerConfig config, ListenerException startupFailure) {
        this.config = Objects.requireNonNull(config, "config");
        this.startupFailure = startupFailure;
        this.address = new InetSocketAddress("127.0.0.1", config.bindAddress().getPort());
    }

    public static FakeNetworkListener serving(ListenerConfig config) {
        return new FakeNetworkListener(config, null);
    }

    public static FakeNetworkListener failingOnStart(ListenerConfig config, ListenerException failure) {
        return new FakeNetworkListener(config, Objects.requireNonNull(failure, "failure"));
    }

    @Override
    public ListenerConfig config() {
        return config;
    }

    @Override
    public void serve(Runnable onBound) {
        if (startupFailure != null) {
            throw startupFailure;
        }
        onBound.run();
        bound.countDown();
        while (true) {
            try {
                released.await();
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        ListenerException failure = runtimeFailure;
        if (failure != null && !closed) {
            throw failure;
        }
    }

    @Override
    public void close() {
        closeCalls++;
        closed = true;
        released.countDown();
    }

    @Override
    public Optional<InetSocketAddress> boundAddress() {
        return bound.getCount() == 0 ? Optional.of(address) : Optional.empty();
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public boolean awaitBound(long timeout, TimeUnit unit) throws InterruptedException {
        return bound.await(timeout, unit);
    }

    /**
     * Ends the serving loop as if the server socket died.
     */
    public void injectTransportFailure(ListenerException failure) {
        runtimeFailure = Objects.requireNonNull(failure, "failure");
        released.countDown();
    }

    public int closeCalls() {
        return closeCalls;
    }
}
