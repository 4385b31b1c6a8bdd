package org.postevent.cdp.protocol;

import org.postevent.cdp.domains.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The browser-level CDP connection. Frames carrying a session id are routed to the
 * {@link CDPSession} attached under that id, everything else is handled here.
 */
public class CDPClient extends CDPBase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CDPClient.class);
    final Map<String, CDPSession> sessions = new ConcurrentHashMap<>();
    private final CountDownLatch closeLatch = new CountDownLatch(1);
    private final AtomicBoolean closed = new AtomicBoolean();
    private final RPC rpc;

    public CDPClient(URI devtoolsUrl) throws IOException {
        this((handler, closeHandler) -> new RPC.Socket(devtoolsUrl, handler, closeHandler));
    }

    public CDPClient(InputStream inputStream, OutputStream outputStream) throws IOException {
        this((handler, closeHandler) -> new RPC.Pipe(inputStream, outputStream, handler, closeHandler));
    }

    public CDPClient(RPC.Connector connector) throws IOException {
        super("Browser");
        this.rpc = connector.connect(this::handleMessage, this::handleRpcClose);
        domain(Target.class).onDetachedFromTarget(this::handleDetachedFromTarget);
    }

    @Override
    protected void handleMessage(RPC.ServerMessage message) {
        if (message.sessionId() == null) {
            super.handleMessage(message);
        } else {
            var session = sessions.get(message.sessionId());
            if (session != null) {
                session.handleMessage(message);
            } else {
                log.debug("Ignoring CDP message for unknown session: {}", message);
            }
        }
    }

    private void handleDetachedFromTarget(Target.DetachedFromTarget event) {
        var session = sessions.get(event.sessionId());
        if (session != null) {
            log.debug("Browser detached session {} from target {}", event.sessionId(), session.targetId());
            session.handleDetached();
        }
    }

    private void handleRpcClose() {
        if (!changeState(() -> closed.compareAndSet(false, true))) return;
        for (var session : sessions.values()) {
            session.handleDetached();
        }
        failAll(CDPClosedException::new);
        closeLatch.countDown();
    }

    void send(RPC.Command command) throws IOException {
        rpc.send(command);
    }

    @Override
    protected void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException {
        rpc.send(new RPC.Command(commandId, method, params, null));
    }

    @Override
    protected boolean isOpen() {
        return !closed.get();
    }

    @Override
    protected void checkOpen() {
        if (closed.get()) {
            var e = new CDPClosedException();
            e.actuallyFillInStackTrace();
            throw e;
        }
    }

    /**
     * Waits for the browser to close the connection.
     *
     * @return true if the connection closed within the timeout
     */
    public boolean waitClose(Duration timeout) throws InterruptedException {
        return closeLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        if (closed.get()) return;
        rpc.close();
        // Pipe and Socket report closure through handleRpcClose themselves, this covers connectors that don't
        handleRpcClose();
    }
}
