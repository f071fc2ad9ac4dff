package com.questrail.peerlink.time;

import com.questrail.peerlink.api.ChannelKind;
import com.questrail.peerlink.config.ClientConfig;
import com.questrail.peerlink.connection.MessageHandler;
import com.questrail.peerlink.connection.NetworkConnection;
import com.questrail.peerlink.internal.time.Cancellable;
import com.questrail.peerlink.internal.time.MonotonicClock;
import com.questrail.peerlink.internal.time.MonotonicScheduler;

import java.util.Objects;

/**
 * NetworkTime
 * -----------------------------------------------------------------------------
 * Client-side estimate of round-trip time and of the server's clock.
 *
 * <p>While started, a ping goes out over the unreliable channel immediately and
 * then every {@link ClientConfig#pingInterval()}. Each pong adds one sample to
 * two moving averages:</p>
 * <ul>
 *   <li>round trip: {@code now - clientTime}</li>
 *   <li>offset: {@code now - rtt / 2 - serverTime}</li>
 * </ul>
 * {@link #serverTimeNanos()} is then {@code now - offset}.
 *
 * <p>Ping scheduling is driven by a {@link MonotonicScheduler} so tests can
 * step it deterministically.</p>
 */
public final class NetworkTime {

    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final ClientConfig config;

    private final ExponentialMovingAverage rtt;
    private final ExponentialMovingAverage offset;

    private NetworkConnection connection;
    private Cancellable nextPing;
    private long pingsSent;

    public NetworkTime(MonotonicClock clock, MonotonicScheduler scheduler, ClientConfig config) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.config = Objects.requireNonNull(config, "config");
        this.rtt = new ExponentialMovingAverage(config.pingWindowSize());
        this.offset = new ExponentialMovingAverage(config.pingWindowSize());
    }

    /**
     * Reset the estimates and start pinging over {@code connection}.
     */
    public synchronized void start(NetworkConnection connection) {
        Objects.requireNonNull(connection, "connection");
        stop();
        rtt.reset();
        offset.reset();
        this.connection = connection;
        ping();
    }

    public synchronized void stop() {
        if (nextPing != null) {
            nextPing.cancel();
            nextPing = null;
        }
        connection = null;
    }

    /**
     * Stop only if pinging is bound to {@code expected}. A connection that ends
     * after a newer one has started leaves the newer one's pings alone.
     */
    public synchronized void stop(NetworkConnection expected) {
        if (connection == expected) {
            stop();
        }
    }

    private synchronized void ping() {
        NetworkConnection target = connection;
        if (target == null) {
            return;
        }
        if (!target.isConnected()) {
            stop();
            return;
        }
        target.send(new NetworkPingMessage(clock.nowNanos()), ChannelKind.UNRELIABLE);
        pingsSent++;
        nextPing = scheduler.scheduleAfter(config.pingInterval(), clock, this::ping);
    }

    public synchronized void onClientPong(NetworkPongMessage pong) {
        long now = clock.nowNanos();
        double sampleRtt = now - pong.clientTimeNanos();
        if (sampleRtt < 0) {
            return;
        }
        rtt.add(sampleRtt);
        offset.add(now - sampleRtt * 0.5 - pong.serverTimeNanos());
    }

    /**
     * Smoothed round-trip time in nanoseconds; zero before the first pong.
     */
    public synchronized double roundTripTimeNanos() {
        return rtt.value();
    }

    public synchronized double roundTripTimeStandardDeviationNanos() {
        return rtt.standardDeviation();
    }

    public synchronized double offsetNanos() {
        return offset.value();
    }

    /**
     * Estimated server clock; the local clock until the first pong arrives.
     */
    public synchronized long serverTimeNanos() {
        return clock.nowNanos() - Math.round(offset.value());
    }

    public synchronized boolean hasSamples() {
        return rtt.isInitialized();
    }

    public synchronized long pingsSent() {
        return pingsSent;
    }

    /**
     * Handler a server installs on every connection to answer pings.
     */
    public static MessageHandler<NetworkPingMessage> serverPingHandler(MonotonicClock clock) {
        Objects.requireNonNull(clock, "clock");
        return (conn, ping) -> conn.send(
            new NetworkPongMessage(ping.clientTimeNanos(), clock.nowNanos()), ChannelKind.UNRELIABLE);
    }
}
