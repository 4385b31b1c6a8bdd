package org.postevent.cdp.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.core.util.Separators.Spacing;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Proxy;
import java.lang.reflect.Type;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static org.postevent.cdp.util.LogUtils.ellipses;

/**
 * Command/response correlation and event dispatch shared by the browser-level connection and the
 * per-target sessions.
 * <p>
 * Each instance has its own command id sequence and pending-command table, so ids only need to be
 * unique within one session. Responses and events are processed in arrival order on a single
 * event thread per instance; listeners are called on that thread.
 */
public abstract class CDPBase {
    private static final Logger log = LoggerFactory.getLogger(CDPBase.class);
    private static final ObjectWriter logJson = RPC.JSON.copy()
            .writer().without(JsonWriteFeature.QUOTE_FIELD_NAMES)
            .with(new DefaultPrettyPrinter()
                    .withArrayIndenter(null)
                    .withObjectIndenter(null)
                    .withSeparators(new Separators()
                            .withObjectEntrySpacing(Spacing.AFTER)
                            .withObjectFieldValueSpacing(Spacing.AFTER)));
    private final AtomicLong idSeq = new AtomicLong();
    private final Map<Long, CompletableFuture<JsonNode>> commands = new ConcurrentHashMap<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService executor;
    // held shared while checking state and transmitting, exclusively while closing
    private final ReadWriteLock stateLock = new ReentrantReadWriteLock();
    private volatile Thread executorThread;

    protected CDPBase(String name) {
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, name + "-CDP");
            thread.setDaemon(true);
            executorThread = thread;
            return thread;
        });
    }

    /**
     * Returns a proxy that turns calls on a domain interface into commands. The interface's simple
     * name is the domain name, each parameter name is sent as the protocol parameter of the same name
     * (null arguments are omitted) and methods named {@code onSomething} taking a single
     * {@code Consumer<Something>} register event listeners.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public <T> T domain(Class<T> domainInterface) {
        return (T) Proxy.newProxyInstance(domainInterface.getClassLoader(), new Class[]{domainInterface},
                (proxy, method, args) -> {
                    if (method.getDeclaringClass() == Object.class) {
                        return switch (method.getName()) {
                            case "toString" -> domainInterface.getSimpleName() + "@" + System.identityHashCode(proxy);
                            case "hashCode" -> System.identityHashCode(proxy);
                            case "equals" -> proxy == args[0];
                            default -> throw new UnsupportedOperationException(method.getName());
                        };
                    }
                    var methodParameters = method.getParameters();
                    if (method.getName().startsWith("on") && methodParameters.length == 1
                        && method.getParameterTypes()[0] == Consumer.class) {
                        var type = ((ParameterizedType) method.getGenericParameterTypes()[0]);
                        var eventClass = (Class<?>) type.getActualTypeArguments()[0];
                        return addListener(eventClass, (Consumer) args[0]);
                    }
                    var params = new HashMap<String, Object>(methodParameters.length);
                    for (int i = 0; i < methodParameters.length; i++) {
                        if (!methodParameters[i].isNamePresent()) {
                            throw new IllegalStateException("Parameter names unavailable for " + method
                                                            + ", compile with -parameters");
                        }
                        if (args[i] != null) params.put(methodParameters[i].getName(), args[i]);
                    }
                    return sendCommand(commandName(domainInterface, method), params,
                            method.getGenericReturnType(), method.getAnnotation(Unwrap.class));
                });
    }

    private static String commandName(Class<?> domainInterface, Method method) {
        String name = method.getName();
        if (name.endsWith("Async")) {
            name = name.substring(0, name.length() - "Async".length());
        }
        return domainInterface.getSimpleName() + "." + name;
    }

    protected void handleMessage(RPC.ServerMessage message) {
        try {
            executor.submit(() -> {
                if (message instanceof RPC.Event event) {
                    handleEvent(event);
                } else if (message instanceof RPC.Response response) {
                    handleResponse(response);
                } else {
                    log.error("Unknown message type: {}", message);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Caught rejected execution exception, session is probably closing", e);
        }
    }

    private void handleResponse(RPC.Response response) {
        var future = commands.remove(response.id());
        if (future == null) {
            log.warn("Received response to unknown call id {}", response.id());
        } else if (response.error() == null) {
            future.complete(response.result());
        } else {
            future.completeExceptionally(new CDPException(response.error().code(), response.error().message()));
        }
    }

    private void handleEvent(RPC.Event event) {
        if (log.isTraceEnabled()) {
            try {
                log.trace("{}{}", event.method(), ellipses(logJson.writeValueAsString(event.params())));
            } catch (JsonProcessingException ignored) {
            }
        }
        for (Listener listener : listeners) {
            if (!listener.matches(event.method())) continue;
            try {
                listener.callback.accept(event);
            } catch (Exception e) {
                log.error("{} handler threw", event.method(), e);
            }
        }
    }

    /**
     * Protocol event name for an event record nested in a domain interface, for example
     * {@code Page.LoadEventFired} becomes {@code Page.loadEventFired}.
     */
    public static String eventName(Class<?> eventClass) {
        String className = eventClass.getSimpleName();
        return eventClass.getEnclosingClass().getSimpleName() + "."
               + className.substring(0, 1).toLowerCase(Locale.ROOT)
               + className.substring(1);
    }

    public <T> Subscription addListener(Class<T> eventClass, Consumer<T> callback) {
        return addListener(Set.of(eventName(eventClass)), event -> {
            try {
                callback.accept(RPC.JSON.treeToValue(event.params(), eventClass));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    /**
     * Registers a listener for events with any of the given method names, or for every event if
     * {@code methods} is empty. The listener stays registered until the returned subscription is
     * closed or this session closes.
     */
    public Subscription addListener(Collection<String> methods, Consumer<RPC.Event> callback) {
        return addListener(methods, callback, null);
    }

    private Subscription addListener(Collection<String> methods, Consumer<RPC.Event> callback,
                                     Consumer<CDPException> onClose) {
        checkOpen();
        var listener = new Listener(Set.copyOf(methods), callback, onClose);
        listener.subscription = new Subscription(() -> {
            listener.active.set(false);
            listeners.remove(listener);
        });
        var subscription = listener.subscription;
        listeners.add(listener);
        // lost a race with close(), which may have already swept the registry
        if (!isOpen()) {
            subscription.close();
            checkOpen();
        }
        return subscription;
    }

    /**
     * Starts listening for the first event with one of the given method names. Register before
     * triggering whatever causes the event, then call {@link EventWait#await(Duration)}.
     */
    public EventWait expectEvent(Collection<String> methods) {
        var future = new CompletableFuture<RPC.Event>();
        var subscription = addListener(methods, future::complete, future::completeExceptionally);
        return new EventWait(Set.copyOf(methods), future, subscription);
    }

    /**
     * Waits for the next event with one of the given method names.
     *
     * @throws CDPTimeoutException if no such event arrives within {@code timeout}
     */
    public RPC.Event waitForEvent(Collection<String> methods, Duration timeout) throws InterruptedException {
        try (var wait = expectEvent(methods)) {
            return wait.await(timeout);
        }
    }

    /**
     * Number of registered listeners.
     */
    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Sends a command and blocks until its response arrives.
     *
     * @return the result object of the response
     * @throws CDPException if the browser replied with an error
     * @throws NotAttachedException if the session is not attached or detaches while waiting
     */
    public JsonNode send(String method, Map<String, Object> params) {
        checkNotOnEventThread();
        return await(sendAsync(method, params));
    }

    /**
     * Sends a command without waiting. The returned future completes with the result object of the
     * response, or exceptionally with a {@link CDPException}.
     */
    public CompletableFuture<JsonNode> sendAsync(String method, Map<String, Object> params) {
        var future = new CompletableFuture<JsonNode>();
        stateLock.readLock().lock();
        try {
            checkOpen();
            transmit(method, params, future);
        } finally {
            stateLock.readLock().unlock();
        }
        return future;
    }

    private void transmit(String method, Map<String, Object> params, CompletableFuture<JsonNode> future) {
        long commandId = idSeq.incrementAndGet();

        if (log.isTraceEnabled()) {
            try {
                log.trace("[{}] {}{}", commandId, method, ellipses(logJson.writeValueAsString(params)));
            } catch (JsonProcessingException ignored) {
            }
            future.whenComplete((result, ex) -> {
                try {
                    if (ex == null) {
                        log.trace("[{}] {} [{}]", commandId, ellipses(logJson.writeValueAsString(result)), method);
                    } else {
                        log.trace("[{}] {}", commandId, ex.getMessage());
                    }
                } catch (JsonProcessingException ignored) {
                }
            });
        }

        commands.put(commandId, future);
        try {
            sendCommandMessage(commandId, method, params);
        } catch (IOException e) {
            commands.remove(commandId);
            future.completeExceptionally(new UncheckedIOException(e));
        }
    }

    Object sendCommand(String method, Map<String, Object> params, Type returnType, Unwrap unwrap) {
        Type valueType;
        boolean returnsCompletionStage;
        if (returnType instanceof ParameterizedType parameterizedType &&
            CompletionStage.class.isAssignableFrom((Class<?>) parameterizedType.getRawType())) {
            valueType = parameterizedType.getActualTypeArguments()[0];
            returnsCompletionStage = true;
        } else {
            valueType = returnType;
            returnsCompletionStage = false;
            checkNotOnEventThread();
        }

        CompletableFuture<?> mappedFuture = sendAsync(method, params)
                .thenApply(result -> convertResult(result, valueType, unwrap));
        return returnsCompletionStage ? mappedFuture : await(mappedFuture);
    }

    private static Object convertResult(JsonNode result, Type valueType, Unwrap unwrap) {
        if (valueType == void.class || valueType == Void.class) return null;
        JsonNode node = result;
        if (unwrap != null) {
            String field = unwrap.value().isEmpty() ?
                    lowercaseFirstLetter(((Class<?>) valueType).getSimpleName()) : unwrap.value();
            node = result == null ? null : result.get(field);
        }
        if (node == null) return null;
        try {
            return RPC.JSON.readerFor(RPC.JSON.constructType(valueType)).readValue(node);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void checkNotOnEventThread() {
        if (Thread.currentThread() == executorThread) {
            throw new IllegalStateException("Sending command on the event handler thread would deadlock");
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CDPException cdpException) {
                cdpException.actuallyFillInStackTrace();
                throw cdpException;
            } else if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            } else {
                throw new RuntimeException(e.getCause());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CDPTimeoutException("Interrupted");
        }
    }

    private static String lowercaseFirstLetter(String s) {
        return s.substring(0, 1).toLowerCase(Locale.ROOT) + s.substring(1);
    }

    protected abstract void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException;

    /**
     * Whether commands may currently be sent.
     */
    protected abstract boolean isOpen();

    /**
     * Throws the appropriate exception if {@link #isOpen()} is false.
     */
    protected abstract void checkOpen();

    /**
     * Runs {@code transition} while no command is between its state check and its transmission.
     * Subclasses change state to closed through this so no frame leaves after the change.
     */
    protected <T> T changeState(Supplier<T> transition) {
        stateLock.writeLock().lock();
        try {
            return transition.get();
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    /**
     * Fails every outstanding command and event wait, removes all listeners and stops the event thread.
     * Subclasses must make {@link #isOpen()} return false before calling this.
     */
    protected void failAll(Supplier<? extends CDPException> reason) {
        for (var commandId : commands.keySet()) {
            var future = commands.remove(commandId);
            if (future != null) future.completeExceptionally(reason.get());
        }
        for (Listener listener : listeners) {
            listener.subscription.close();
            if (listener.onClose != null) listener.onClose.accept(reason.get());
        }
        executor.shutdown();
    }

    private static class Listener {
        private final Set<String> methods;
        private final Consumer<RPC.Event> callback;
        private final Consumer<CDPException> onClose;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private volatile Subscription subscription;

        Listener(Set<String> methods, Consumer<RPC.Event> callback, Consumer<CDPException> onClose) {
            this.methods = methods;
            this.callback = callback;
            this.onClose = onClose;
        }

        boolean matches(String method) {
            return active.get() && (methods.isEmpty() || methods.contains(method));
        }
    }
}
