package org.postevent.cdp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.postevent.cdp.protocol.CDPClient;
import org.postevent.cdp.protocol.RPC;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * In-process stand-in for a browser's end of the CDP connection. Understands the handful of Target,
 * Page, Runtime and DOM commands a {@link Tab} uses; tests override or add methods with
 * {@link #on(String, Function)}. Replies and events are delivered from a separate thread, optionally
 * delayed, the way a real browser would.
 */
public class FakeBrowser implements RPC {
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        var thread = new Thread(r, "FakeBrowser");
        thread.setDaemon(true);
        return thread;
    });
    private final Map<String, Function<Command, Reply>> handlers = new ConcurrentHashMap<>();
    private final List<Command> received = new CopyOnWriteArrayList<>();
    private final Set<String> openTargets = ConcurrentHashMap.newKeySet();
    private final Map<String, String> sessionTargets = new ConcurrentHashMap<>();
    private final AtomicInteger targetSeq = new AtomicInteger();
    private final AtomicInteger sessionSeq = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Consumer<ServerMessage> messageHandler;
    private volatile Runnable closeHandler;
    private volatile long loadEventDelayMillis = 10;
    private volatile Function<String, Reply> evaluator = expression -> Reply.undefined();

    public FakeBrowser() {
        on("Target.createTarget", command -> {
            String targetId = "TARGET-" + targetSeq.incrementAndGet();
            openTargets.add(targetId);
            return Reply.ok(Map.of("targetId", targetId));
        });
        on("Target.attachToTarget", command -> {
            String targetId = (String) command.params().get("targetId");
            if (!openTargets.contains(targetId)) return Reply.error(-32602, "No target with given id found");
            String sessionId = "SESSION-" + sessionSeq.incrementAndGet();
            sessionTargets.put(sessionId, targetId);
            return Reply.ok(Map.of("sessionId", sessionId));
        });
        on("Target.detachFromTarget", command -> {
            if (sessionTargets.remove((String) command.params().get("sessionId")) == null) {
                return Reply.error(-32602, "No session with given id found");
            }
            return Reply.ok(Map.of());
        });
        on("Target.closeTarget", command -> {
            if (!openTargets.remove((String) command.params().get("targetId"))) {
                return Reply.error(-32602, "No target with given id found");
            }
            return Reply.ok(Map.of("success", true));
        });
        on("Page.enable", command -> Reply.ok(Map.of()));
        on("Runtime.enable", command -> Reply.ok(Map.of()));
        on("DOM.enable", command -> Reply.ok(Map.of()));
        on("Page.navigate", command -> {
            long delay = loadEventDelayMillis;
            if (delay >= 0) {
                emit(command.sessionId(), "Page.domContentEventFired", Map.of("timestamp", 1.0), delay / 2);
                emit(command.sessionId(), "Page.loadEventFired", Map.of("timestamp", 2.0), delay);
            }
            return Reply.ok(Map.of("frameId", sessionTargets.getOrDefault(command.sessionId(), "?"),
                    "loaderId", "LOADER-1"));
        });
        on("Page.addScriptToEvaluateOnNewDocument", command -> Reply.ok(Map.of("identifier", "1")));
        on("Page.removeScriptToEvaluateOnNewDocument", command -> Reply.ok(Map.of()));
        on("Runtime.evaluate", command -> evaluator.apply((String) command.params().get("expression")));
        on("Browser.getVersion", command -> Reply.ok(Map.of("protocolVersion", "1.3", "product", "FakeBrowser/1.0")));
    }

    /**
     * A connected client whose transport is this fake.
     */
    public CDPClient connect() throws IOException {
        return new CDPClient((handler, onClose) -> {
            this.messageHandler = handler;
            this.closeHandler = onClose;
            return this;
        });
    }

    public void on(String method, Function<Command, Reply> handler) {
        handlers.put(method, handler);
    }

    /**
     * Handles Runtime.evaluate by expression text.
     */
    public void evaluator(Function<String, Reply> evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Delay between Page.navigate and Page.loadEventFired (DOMContentLoaded fires halfway), or -1 for never.
     */
    public void loadEventDelay(long millis) {
        this.loadEventDelayMillis = millis;
    }

    public void emit(String sessionId, String method, Object params, long delayMillis) {
        ObjectNode paramsNode = RPC.JSON.valueToTree(params);
        scheduler.schedule(() -> deliver(new RPC.Event(method, paramsNode, sessionId)), delayMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void send(Command command) throws IOException {
        if (closed.get()) throw new IOException("Stream closed");
        // round trip through JSON like the real transports do
        Command decoded = roundTrip(command);
        received.add(decoded);
        var handler = handlers.get(decoded.method());
        Reply reply = handler == null ?
                Reply.error(-32601, "'" + decoded.method() + "' wasn't found") : handler.apply(decoded);
        if (reply == null) return; // never answered
        scheduler.schedule(() -> deliver(new RPC.Response(decoded.id(), reply.result(), reply.error(), decoded.sessionId())),
                reply.delayMillis(), TimeUnit.MILLISECONDS);
    }

    private static Command roundTrip(Command command) {
        try {
            return RPC.JSON.readValue(RPC.JSON.writeValueAsString(command), Command.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void deliver(ServerMessage message) {
        if (!closed.get()) messageHandler.accept(message);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            scheduler.shutdownNow();
            closeHandler.run();
        }
    }

    public List<Command> received() {
        return List.copyOf(received);
    }

    public List<Command> received(String method) {
        return received.stream().filter(command -> command.method().equals(method)).toList();
    }

    public boolean isTargetOpen(String targetId) {
        return openTargets.contains(targetId);
    }

    public boolean isSessionAttached(String sessionId) {
        return sessionTargets.containsKey(sessionId);
    }

    /**
     * Arguments of an expression built by {@link Scripts#call(String, Object...)} for the given
     * function, decoded back from their literals, or null if the expression calls something else.
     */
    @SuppressWarnings("unchecked")
    public static List<Object> callArguments(String expression, String function) {
        String prefix = "(" + function + ")(";
        if (!expression.startsWith(prefix) || !expression.endsWith(")")) return null;
        String literals = expression.substring(prefix.length(), expression.length() - 1);
        try {
            return RPC.JSON.readValue("[" + literals + "]", List.class);
        } catch (JsonProcessingException e) {
            throw new AssertionError("Arguments are not valid literals: " + literals, e);
        }
    }

    public record Reply(ObjectNode result, RPC.Error error, long delayMillis) {
        public static Reply ok(Object result) {
            return new Reply(RPC.JSON.valueToTree(result), null, 0);
        }

        public static Reply error(int code, String message) {
            return new Reply(null, new RPC.Error(code, message), 0);
        }

        /**
         * A Runtime.evaluate reply for a by-value result.
         */
        public static Reply value(Object value) {
            var remoteObject = new LinkedHashMap<String, Object>();
            if (value == null) {
                remoteObject.put("type", "object");
                remoteObject.put("subtype", "null");
            } else {
                remoteObject.put("type", value instanceof String ? "string" :
                        value instanceof Boolean ? "boolean" :
                                value instanceof Number ? "number" : "object");
            }
            remoteObject.put("value", value);
            var result = new HashMap<String, Object>();
            result.put("result", remoteObject);
            return ok(result);
        }

        public static Reply undefined() {
            return ok(Map.of("result", Map.of("type", "undefined")));
        }

        public static Reply exception(String description) {
            return ok(Map.of(
                    "result", Map.of("type", "object", "subtype", "error", "description", description),
                    "exceptionDetails", Map.of(
                            "exceptionId", 1,
                            "text", "Uncaught",
                            "lineNumber", 0,
                            "columnNumber", 5,
                            "exception", Map.of("type", "object", "subtype", "error", "description", description))));
        }

        public Reply delayed(long millis) {
            return new Reply(result, error, millis);
        }
    }
}
