package org.postevent.cdp.protocol;

import org.postevent.cdp.domains.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A flattened CDP session attached to a single target. Single use: it is attached at most once and
 * once closed (locally or by the browser) it never becomes attached again.
 */
public class CDPSession extends CDPBase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CDPSession.class);
    private final CDPClient client;
    private final String targetId;
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final AtomicBoolean tornDown = new AtomicBoolean();
    private volatile String sessionId;

    public enum State {NEW, ATTACHED, CLOSED}

    public CDPSession(CDPClient client, String targetId) {
        super("Target-" + targetId.substring(0, Math.min(8, targetId.length())));
        this.client = client;
        this.targetId = targetId;
    }

    /**
     * Attaches to the target in flat mode.
     *
     * @throws AttachException if the browser refuses, for example because the target is gone
     * @throws IllegalStateException if this session was already attached or closed
     */
    public void attach() {
        if (state.get() != State.NEW) {
            throw new IllegalStateException("Session for target " + targetId + " is " + state.get());
        }
        String id;
        try {
            id = client.domain(Target.class).attachToTarget(targetId, true);
        } catch (CDPException e) {
            throw new AttachException(targetId, "Failed to attach: " + e.getMessage(), e);
        }
        sessionId = id;
        client.sessions.put(id, this);
        if (!state.compareAndSet(State.NEW, State.ATTACHED)) {
            client.sessions.remove(id);
            throw new AttachException(targetId, "Session closed while attaching", null);
        }
        log.debug("Attached session {} to target {}", id, targetId);
    }

    @Override
    protected void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException {
        client.send(new RPC.Command(commandId, method, params, sessionId));
    }

    @Override
    protected boolean isOpen() {
        return state.get() == State.ATTACHED;
    }

    /**
     * @throws NotAttachedException unless the session is attached
     */
    @Override
    public void checkOpen() {
        if (state.get() != State.ATTACHED) {
            var e = new NotAttachedException(targetId);
            e.actuallyFillInStackTrace();
            throw e;
        }
    }

    /**
     * Called when the browser detached this session on its own or the connection was lost.
     */
    void handleDetached() {
        if (changeState(() -> state.getAndSet(State.CLOSED)) == State.ATTACHED) {
            client.sessions.remove(sessionId);
            failAll(() -> new NotAttachedException(targetId));
        }
    }

    /**
     * Detaches from and closes the target. Outstanding commands and event waits fail with
     * {@link NotAttachedException}. Failures to detach or close the target are logged and ignored,
     * the target may already be gone. Safe to call repeatedly and on a session that never attached.
     */
    @Override
    public void close() {
        if (!tornDown.compareAndSet(false, true)) return;
        State previous = changeState(() -> state.getAndSet(State.CLOSED));
        failAll(() -> new NotAttachedException(targetId));
        Target target = client.domain(Target.class);
        if (previous == State.ATTACHED) {
            try {
                target.detachFromTarget(sessionId);
            } catch (Exception e) {
                log.debug("Error detaching session {}", sessionId, e);
            }
        }
        if (sessionId != null) client.sessions.remove(sessionId);
        try {
            target.closeTarget(targetId);
        } catch (Exception e) {
            log.warn("Error closing session target {}: {}", targetId, e.getMessage());
        }
    }

    public State state() {
        return state.get();
    }

    public boolean isAttached() {
        return state.get() == State.ATTACHED;
    }

    public String targetId() {
        return targetId;
    }

    public String sessionId() {
        return sessionId;
    }
}
