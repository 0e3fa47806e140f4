package org.netpreserve.scrapekit.cdp.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * JSON-RPC message transport to a browser. Two framings are supported: a WebSocket to the browser's
 * devtools endpoint and the NUL-delimited pipe used with {@code --remote-debugging-pipe}.
 */
public interface RPC {
    ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    int TRACE_MESSAGE_LIMIT = 1024;

    void send(Command message) throws IOException;

    void close();

    static String abbreviate(String message) {
        return StringUtils.abbreviateMiddle(message, "...", TRACE_MESSAGE_LIMIT);
    }

    record Command(long id, String method, Map<String, Object> params, String sessionId) {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
    @JsonSubTypes({@JsonSubTypes.Type(Event.class), @JsonSubTypes.Type(Response.class)})
    interface ServerMessage {
        String sessionId();
    }

    record Event(String method, ObjectNode params, String sessionId) implements ServerMessage {
    }

    record Response(long id, ObjectNode result, Error error, String sessionId) implements ServerMessage {
    }

    record Error(int code, String message) {
    }

    /**
     * Receives messages from the browser and is told once when the connection goes away.
     */
    interface Receiver {
        void onMessage(ServerMessage message);

        void onClose();
    }

    class Socket implements RPC {
        private static final Logger log = LoggerFactory.getLogger(Socket.class);
        private static final HttpClient httpClient = HttpClient.newHttpClient();
        private final WebSocket webSocket;
        private final Receiver receiver;
        private final AtomicBoolean closed = new AtomicBoolean();

        public Socket(URI devtoolsUrl, Receiver receiver) throws IOException {
            this.receiver = receiver;
            try {
                this.webSocket = httpClient.newWebSocketBuilder()
                        .buildAsync(devtoolsUrl, new Listener())
                        .get(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted connecting to " + devtoolsUrl, e);
            } catch (ExecutionException | TimeoutException e) {
                throw new IOException("Unable to connect to " + devtoolsUrl, e);
            }
        }

        @Override
        public void send(Command message) throws JsonProcessingException {
            webSocket.sendText(JSON.writeValueAsString(message), true);
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) return;
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "");
            webSocket.abort();
            receiver.onClose();
        }

        private class Listener implements WebSocket.Listener {
            private final StringBuilder buffer = new StringBuilder();

            @Override
            public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                buffer.append(data);
                if (last) {
                    String text = buffer.toString();
                    buffer.setLength(0);
                    try {
                        receiver.onMessage(JSON.readValue(text, ServerMessage.class));
                    } catch (IOException e) {
                        log.error("Failed to parse message: {}", abbreviate(text), e);
                    }
                }
                webSocket.request(1);
                return null;
            }

            @Override
            public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                log.debug("WebSocket closed by browser: {} {}", statusCode, reason);
                Socket.this.close();
                return null;
            }

            @Override
            public void onError(WebSocket webSocket, Throwable error) {
                log.warn("WebSocket error", error);
                Socket.this.close();
            }
        }
    }

    class Pipe implements RPC {
        private static final Logger log = LoggerFactory.getLogger(Pipe.class);
        private final InputStream inputStream;
        private final OutputStream outputStream;
        private final Receiver receiver;
        private final Lock writeLock = new ReentrantLock();
        private final AtomicBoolean closed = new AtomicBoolean();

        public Pipe(InputStream inputStream, OutputStream outputStream, Receiver receiver) {
            this.inputStream = new BufferedInputStream(inputStream, 64 * 1024);
            this.outputStream = outputStream;
            this.receiver = receiver;
            var thread = new Thread(this::run, "CDP.Pipe");
            thread.setDaemon(true);
            thread.start();
        }

        private void run() {
            var message = new ByteArrayOutputStream();
            try {
                int b;
                while ((b = inputStream.read()) >= 0) {
                    if (b != 0) {
                        message.write(b);
                        continue;
                    }
                    dispatch(message.toByteArray());
                    message.reset();
                }
                log.debug("Received end of stream");
            } catch (IOException e) {
                if (!closed.get()) log.error("Error reading CDP pipe", e);
            } finally {
                close();
            }
        }

        private void dispatch(byte[] bytes) {
            if (log.isTraceEnabled()) {
                log.trace("<- {}", abbreviate(new String(bytes, StandardCharsets.UTF_8)));
            }
            try {
                receiver.onMessage(JSON.readValue(bytes, ServerMessage.class));
            } catch (IOException e) {
                log.error("Failed to parse message: {}", abbreviate(new String(bytes, StandardCharsets.UTF_8)), e);
            }
        }

        @Override
        public void send(Command message) throws IOException {
            if (closed.get()) throw new CDPClosedException();
            writeLock.lock();
            try {
                if (log.isTraceEnabled()) {
                    log.trace("-> {}", abbreviate(JSON.writeValueAsString(message)));
                }
                JSON.writeValue(outputStream, message);
                outputStream.write(0);
                outputStream.flush();
            } finally {
                writeLock.unlock();
            }
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) return;
            try {
                outputStream.close();
            } catch (IOException e) {
                log.debug("Error closing CDP pipe output", e);
            }
            try {
                inputStream.close();
            } catch (IOException e) {
                log.debug("Error closing CDP pipe input", e);
            }
            receiver.onClose();
        }
    }
}
