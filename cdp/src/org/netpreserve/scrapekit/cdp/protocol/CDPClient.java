package org.netpreserve.scrapekit.cdp.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Browser-level connection. Messages tagged with a session id are routed to the matching {@link CDPSession}.
 */
public class CDPClient extends CDPBase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CDPClient.class);
    private final AtomicLong idSeq = new AtomicLong();
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();
    final Map<String, CDPSession> sessions = new ConcurrentHashMap<>();
    final RPC rpc;

    public CDPClient(URI devtoolsUrl) throws IOException {
        this.rpc = new RPC.Socket(devtoolsUrl, new Receiver());
    }

    public CDPClient(InputStream inputStream, OutputStream outputStream) {
        this.rpc = new RPC.Pipe(inputStream, outputStream, new Receiver());
    }

    /**
     * Registers a callback run once when the connection to the browser is lost or closed.
     */
    public void onDisconnect(Runnable listener) {
        closeListeners.add(listener);
    }

    @Override
    public void close() {
        rpc.close();
        super.close();
    }

    private void route(RPC.ServerMessage message) {
        if (message.sessionId() == null) {
            handleMessage(message);
            return;
        }
        var session = sessions.get(message.sessionId());
        if (session != null) {
            session.handleMessage(message);
        } else {
            log.debug("Ignoring CDP message for unknown session {}", message.sessionId());
        }
    }

    private void disconnected() {
        handleRpcClose();
        sessions.values().forEach(CDPBase::handleRpcClose);
        for (var listener : closeListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Disconnect listener threw", e);
            }
        }
    }

    @Override
    protected void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException {
        rpc.send(new RPC.Command(commandId, method, params, null));
    }

    @Override
    protected long nextCommandId() {
        return idSeq.incrementAndGet();
    }

    private class Receiver implements RPC.Receiver {
        @Override
        public void onMessage(RPC.ServerMessage message) {
            route(message);
        }

        @Override
        public void onClose() {
            disconnected();
        }
    }
}
