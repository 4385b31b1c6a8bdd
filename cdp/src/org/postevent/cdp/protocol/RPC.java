package org.postevent.cdp.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.postevent.cdp.util.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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
 * The duplex channel to a browser. Sends command frames and hands every received frame, already
 * decoded into a {@link Response} or an {@link Event}, to the message handler it was created with.
 */
public interface RPC {
    ObjectMapper JSON = new ObjectMapper(new JsonFactoryBuilder()
            .streamReadConstraints(StreamReadConstraints.builder().maxStringLength(300 * 1024 * 1024).build())
            .build())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    void send(Command message) throws IOException;

    void close();

    /**
     * Opens a channel. The message handler receives every decoded frame, the close handler is run
     * once when the channel stops delivering frames (end of stream, socket closed or {@link #close()}).
     */
    @FunctionalInterface
    interface Connector {
        RPC connect(Consumer<ServerMessage> messageHandler, Runnable closeHandler) throws IOException;
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
     * Decodes one frame and hands it to {@code handler}. Frames that fail to decode are logged and dropped.
     */
    private static void dispatch(Logger log, String frame, Consumer<ServerMessage> handler) {
        if (log.isTraceEnabled()) {
            log.trace("<- {}", LogUtils.ellipses(frame));
        }
        ServerMessage message;
        try {
            message = JSON.readValue(frame, ServerMessage.class);
        } catch (IOException e) {
            log.error("Dropping undecodable frame: {}", LogUtils.ellipses(frame), e);
            return;
        }
        handler.accept(message);
    }

    /**
     * DevTools WebSocket transport, as used with {@code --remote-debugging-port}.
     */
    class Socket implements RPC {
        private static final Logger log = LoggerFactory.getLogger(Socket.class);
        private static final HttpClient httpClient = HttpClient.newHttpClient();
        private final Consumer<ServerMessage> messageHandler;
        private final Runnable closeHandler;
        private final Lock writeLock = new ReentrantLock();
        private final AtomicBoolean closed = new AtomicBoolean();
        private final WebSocket webSocket;

        public Socket(URI devtoolsUrl, Consumer<ServerMessage> messageHandler, Runnable closeHandler) throws IOException {
            this.messageHandler = messageHandler;
            this.closeHandler = closeHandler;
            try {
                this.webSocket = httpClient.newWebSocketBuilder()
                        .buildAsync(devtoolsUrl, new FrameListener())
                        .get(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted connecting to " + devtoolsUrl, e);
            } catch (ExecutionException | TimeoutException e) {
                throw new IOException("Failed to connect to " + devtoolsUrl, e);
            }
        }

        @Override
        public void send(Command command) throws IOException {
            String frame = JSON.writeValueAsString(command);
            if (log.isTraceEnabled()) {
                log.trace("-> {}", LogUtils.ellipses(frame));
            }
            // WebSocket allows only one outstanding send
            writeLock.lock();
            try {
                webSocket.sendText(frame, true).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted sending to WebSocket", e);
            } catch (ExecutionException e) {
                throw new IOException(e.getCause());
            } finally {
                writeLock.unlock();
            }
        }

        @Override
        public void close() {
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "");
            webSocket.abort();
            closed();
        }

        private void closed() {
            if (closed.compareAndSet(false, true)) closeHandler.run();
        }

        private class FrameListener implements WebSocket.Listener {
            private final StringBuilder fragments = new StringBuilder();

            @Override
            public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                fragments.append(data);
                if (last) {
                    String frame = fragments.toString();
                    fragments.setLength(0);
                    dispatch(log, frame, messageHandler);
                }
                webSocket.request(1);
                return null;
            }

            @Override
            public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                log.debug("WebSocket closed: {} {}", statusCode, reason);
                closed();
                return null;
            }

            @Override
            public void onError(WebSocket webSocket, Throwable error) {
                log.error("WebSocket error", error);
                closed();
            }
        }
    }

    /**
     * Transport over a pair of streams carrying NUL-terminated JSON frames, as used with
     * {@code --remote-debugging-pipe}. A daemon thread reads frames until end of stream.
     */
    class Pipe implements RPC {
        private static final Logger log = LoggerFactory.getLogger(Pipe.class);
        private static final int READ_SIZE = 256 * 1024;
        private final InputStream in;
        private final OutputStream out;
        private final Consumer<ServerMessage> messageHandler;
        private final Runnable closeHandler;
        private final Lock writeLock = new ReentrantLock();
        private final AtomicBoolean closed = new AtomicBoolean();

        public Pipe(InputStream in, OutputStream out, Consumer<ServerMessage> messageHandler, Runnable closeHandler) {
            this.in = in;
            this.out = out;
            this.messageHandler = messageHandler;
            this.closeHandler = closeHandler;
            var reader = new Thread(this::readFrames, "CDP-pipe-reader");
            reader.setDaemon(true);
            reader.start();
        }

        private void readFrames() {
            // bytes of a frame whose terminator hasn't arrived yet
            var incomplete = new ByteArrayOutputStream();
            byte[] chunk = new byte[READ_SIZE];
            try {
                int n;
                while ((n = in.read(chunk)) >= 0) {
                    int frameStart = 0;
                    for (int i = 0; i < n; i++) {
                        if (chunk[i] != 0) continue;
                        incomplete.write(chunk, frameStart, i - frameStart);
                        dispatch(log, incomplete.toString(StandardCharsets.UTF_8), messageHandler);
                        incomplete.reset();
                        frameStart = i + 1;
                    }
                    incomplete.write(chunk, frameStart, n - frameStart);
                }
                log.debug("CDP pipe reached end of stream");
            } catch (IOException e) {
                if (!closed.get()) log.error("Error reading CDP pipe", e);
            } finally {
                close();
            }
        }

        @Override
        public void send(Command command) throws IOException {
            byte[] frame = JSON.writeValueAsBytes(command);
            if (log.isTraceEnabled()) {
                log.trace("-> {}", LogUtils.ellipses(new String(frame, StandardCharsets.UTF_8)));
            }
            writeLock.lock();
            try {
                out.write(frame);
                out.write(0);
                out.flush();
            } finally {
                writeLock.unlock();
            }
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) return;
            try {
                out.close();
            } catch (IOException e) {
                log.debug("Error closing CDP pipe output", e);
            }
            try {
                in.close();
            } catch (IOException e) {
                log.debug("Error closing CDP pipe input", e);
            }
            closeHandler.run();
        }
    }
}
