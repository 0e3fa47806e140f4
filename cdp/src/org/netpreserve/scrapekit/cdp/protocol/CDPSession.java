package org.netpreserve.scrapekit.cdp.protocol;

import org.netpreserve.scrapekit.cdp.domains.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Flattened session attached to a single target (tab). Closing it closes the target.
 */
public class CDPSession extends CDPBase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CDPSession.class);
    private final String sessionId;
    private final String targetId;
    private final CDPClient client;

    public CDPSession(CDPClient client, String sessionId, String targetId) {
        this.client = client;
        this.sessionId = sessionId;
        this.targetId = targetId;
        client.sessions.put(sessionId, this);
    }

    @Override
    protected void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException {
        client.rpc.send(new RPC.Command(commandId, method, params, sessionId));
    }

    @Override
    protected long nextCommandId() {
        return client.nextCommandId();
    }

    @Override
    public void close() {
        if (!client.isClosed()) {
            try {
                client.domain(Target.class).closeTarget(targetId);
            } catch (CDPException e) {
                log.warn("Error closing target {}: {}", targetId, e.getMessage());
            }
        }
        client.sessions.remove(sessionId);
        super.close();
    }

    public String targetId() {
        return targetId;
    }
}
