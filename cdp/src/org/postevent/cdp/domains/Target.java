package org.postevent.cdp.domains;

import org.postevent.cdp.protocol.Subscription;
import org.postevent.cdp.protocol.Unwrap;

import java.util.function.Consumer;

public interface Target {
    @Unwrap("targetId")
    String createTarget(String url, Boolean newWindow, Boolean background);

    @Unwrap("sessionId")
    String attachToTarget(String targetId, boolean flatten);

    void detachFromTarget(String sessionId);

    void closeTarget(String targetId);

    Subscription onDetachedFromTarget(Consumer<DetachedFromTarget> handler);

    record DetachedFromTarget(String sessionId, String targetId) {
    }
}
