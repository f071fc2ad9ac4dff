package com.questrail.peerlink.event;

import com.questrail.peerlink.observability.NetworkErrorEvent;
import com.questrail.peerlink.observability.NetworkObservabilitySink;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * NetworkEvent
 * -----------------------------------------------------------------------------
 * Multicast lifecycle notification owned by a client or server
 * ({@code connected}, {@code authenticated}, {@code disconnected}, ...).
 *
 * <h2>Subscription semantics</h2>
 * <ul>
 *   <li>Adding a listener that is already subscribed is a no-op.</li>
 *   <li>Removing a listener that is not subscribed is a no-op.</li>
 *   <li>Listeners are compared with {@code equals}; a method reference
 *       evaluates to a new object each time, so keep the reference you added
 *       if you intend to remove it.</li>
 *   <li>Listeners run in subscription order on the invoking thread. One that
 *       throws is reported to the sink and the rest still run.</li>
 *   <li>Adding or removing during an invocation affects the next invocation
 *       only.</li>
 * </ul>
 *
 * @param <T> payload delivered to listeners
 */
public final class NetworkEvent<T> {

    private final String name;
    private final NetworkObservabilitySink sink;
    private final CopyOnWriteArrayList<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();

    public NetworkEvent(String name, NetworkObservabilitySink sink) {
        this.name = Objects.requireNonNull(name, "name");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * @return {@code true} if the listener was not already subscribed
     */
    public boolean addListener(Consumer<? super T> listener) {
        return listeners.addIfAbsent(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * @return {@code true} if the listener was subscribed
     */
    public boolean removeListener(Consumer<? super T> listener) {
        return listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Deliver {@code value} to every current listener.
     */
    public void invoke(T value) {
        for (Consumer<? super T> listener : listeners) {
            try {
                listener.accept(value);
            } catch (RuntimeException e) {
                sink.onError(new NetworkErrorEvent(Instant.now(), "Listener of " + name + " failed", e));
            }
        }
    }

    @Override
    public String toString() {
        return "NetworkEvent[" + name + ", listeners=" + listeners.size() + "]";
    }
}
