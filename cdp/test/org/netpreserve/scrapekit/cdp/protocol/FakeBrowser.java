package org.netpreserve.scrapekit.cdp.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Function;

/**
 * Plays the browser end of a CDP pipe. Each command received is recorded and answered by the responder,
 * which may return null to leave the command unanswered.
 */
class FakeBrowser {
    final BlockingQueue<JsonNode> received = new LinkedBlockingQueue<>();
    final InputStream clientInput;
    final OutputStream clientOutput;
    private final PipedOutputStream toClient;
    private final PipedInputStream fromClient;
    private volatile Function<JsonNode, String> responder = command -> null;

    FakeBrowser() throws IOException {
        toClient = new PipedOutputStream();
        clientInput = new PipedInputStream(toClient, 64 * 1024);
        fromClient = new PipedInputStream(64 * 1024);
        clientOutput = new PipedOutputStream(fromClient);
        var thread = new Thread(this::run, "fake-browser");
        thread.setDaemon(true);
        thread.start();
    }

    void respondWith(Function<JsonNode, String> responder) {
        this.responder = responder;
    }

    private void run() {
        var buffer = new ByteArrayOutputStream();
        try {
            int b;
            while ((b = fromClient.read()) >= 0) {
                if (b != 0) {
                    buffer.write(b);
                    continue;
                }
                JsonNode command = RPC.JSON.readTree(buffer.toByteArray());
                buffer.reset();
                received.add(command);
                String reply = responder.apply(command);
                if (reply != null) send(reply);
            }
        } catch (IOException e) {
            // client went away
        }
    }

    synchronized void send(String json) throws IOException {
        toClient.write(json.getBytes(StandardCharsets.UTF_8));
        toClient.write(0);
        toClient.flush();
    }

    void disconnect() throws IOException {
        toClient.close();
    }
}
