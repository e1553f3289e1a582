package com.rabbilite.core.connection;

import com.rabbilite.core.config.RabbitConfig;
import com.rabbilite.core.error.ConnectivityException;
import com.rabbilite.core.error.TransportException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns one broker connection and the single channel opened over it.
 *
 * <p>The channel is not safe for concurrent protocol calls, so every operation goes through
 * {@link #withChannel(ChannelCallback)}, which lets one caller in at a time. Producers and consumers each
 * hold their own manager; nothing is shared across client instances.
 */
public class ConnectionManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final RabbitConfig cfg;
    private final Connection conn;
    private final Channel channel;
    private final Object channelLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ConnectionManager(RabbitConfig cfg, Connection conn, Channel channel) {
        this.cfg = cfg;
        this.conn = conn;
        this.channel = channel;
    }

    public static ConnectionManager open(String address) {
        return open(RabbitConfig.forUrl(address));
    }

    public static ConnectionManager open(RabbitConfig cfg) {
        return open(cfg, new ConnectionFactory());
    }

    /**
     * Connects and opens the channel. No retry and no automatic recovery: a broker that is down or
     * refuses the credentials fails this call straight away. {@code f} may carry extra settings such as TLS;
     * address, recovery, timeout and heartbeat are overwritten from {@code cfg}.
     *
     * @throws ConnectivityException if the URL is invalid, the broker is unreachable or auth fails
     */
    public static ConnectionManager open(RabbitConfig cfg, ConnectionFactory f) {
        try {
            f.setUri(cfg.url);
        } catch (Exception e) {
            throw new ConnectivityException("Invalid broker address " + cfg.maskedUrl(), e);
        }
        f.setAutomaticRecoveryEnabled(false);
        f.setTopologyRecoveryEnabled(false);
        f.setConnectionTimeout(cfg.connectionTimeoutMs);
        f.setRequestedHeartbeat(cfg.requestedHeartbeatSec);

        Connection conn;
        try {
            conn = f.newConnection(cfg.connectionName);
        } catch (Exception e) {
            throw new ConnectivityException("Cannot connect to " + cfg.maskedUrl(), e);
        }

        Channel ch;
        try {
            ch = conn.createChannel();
            if (ch == null) throw new IOException("no channel number available");
        } catch (Exception e) {
            closeQuietly(conn);
            throw new ConnectivityException("Cannot open channel on " + cfg.maskedUrl(), e);
        }

        conn.addShutdownListener(cause -> {
            if (!cause.isInitiatedByApplication()) {
                log.warn("[MQ] Connection {} closed by broker: {}", cfg.connectionName, cause.getMessage());
            }
        });
        log.info("[MQ] Connected to {} (connection={}, channel={})",
                cfg.maskedUrl(), cfg.connectionName, ch.getChannelNumber());
        return new ConnectionManager(cfg, conn, ch);
    }

    /** Non-blocking; false once either side has closed the connection. */
    public boolean isConnected() {
        return conn.isOpen();
    }

    public RabbitConfig config() {
        return cfg;
    }

    /**
     * Runs {@code callback} against the channel while holding the channel lock.
     *
     * @throws TransportException if the channel is already closed
     * @throws IOException whatever the protocol call raised; callers map it to topology or transport errors
     */
    public <T> T withChannel(ChannelCallback<T> callback) throws IOException {
        synchronized (channelLock) {
            if (!channel.isOpen()) {
                throw new TransportException("Channel is closed" + closeReason());
            }
            try {
                return callback.doWith(channel);
            } catch (ShutdownSignalException e) {
                throw new TransportException("Channel closed during operation: " + e.getMessage(), e);
            }
        }
    }

    private String closeReason() {
        ShutdownSignalException reason = channel.getCloseReason();
        return reason == null ? "" : " (" + reason.getMessage() + ")";
    }

    /** Releases the channel and then the connection. Safe to call more than once. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (channelLock) {
            try {
                if (channel.isOpen()) channel.close();
            } catch (Exception e) {
                log.warn("[MQ] Error while closing channel: {}", e.toString());
            }
        }
        closeQuietly(conn);
        log.info("[MQ] Closed channel and connection {}", cfg.connectionName);
    }

    private static void closeQuietly(Connection conn) {
        try {
            if (conn.isOpen()) conn.close();
        } catch (Exception e) {
            log.warn("[MQ] Error while closing connection: {}", e.toString());
        }
    }

    @FunctionalInterface
    public interface ChannelCallback<T> {
        T doWith(Channel channel) throws IOException;
    }
}
