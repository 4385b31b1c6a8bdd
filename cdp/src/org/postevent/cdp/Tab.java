package org.postevent.cdp;

import org.intellij.lang.annotations.Language;
import org.postevent.cdp.domains.DOM;
import org.postevent.cdp.domains.Page;
import org.postevent.cdp.domains.Runtime;
import org.postevent.cdp.domains.Target;
import org.postevent.cdp.protocol.AttachException;
import org.postevent.cdp.protocol.CDPClient;
import org.postevent.cdp.protocol.CDPException;
import org.postevent.cdp.protocol.CDPSession;
import org.postevent.cdp.protocol.CDPTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * A browser tab under automation. Wraps one {@link CDPSession} for its whole life: created blank by
 * {@link #open(CDPClient)}, destroyed by {@link #close()}.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 *
 * try (Tab tab = Tab.open(cdp)) {
 *     tab.navigateTo("https://example.com/");
 *     tab.waitForSelector("h1");
 *     String heading = tab.getText("h1");
 * }
 * }</pre>
 *
 * Every operation after {@link #close()} fails with
 * {@link org.postevent.cdp.protocol.NotAttachedException}.
 */
public class Tab implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Tab.class);
    private static final Duration PAUSE_CHECK_INTERVAL = Duration.ofMillis(50);
    private final CDPSession session;
    private final Page page;
    private final Runtime runtime;

    Tab(CDPSession session) {
        this.session = session;
        this.page = session.domain(Page.class);
        this.runtime = session.domain(Runtime.class);
    }

    /**
     * Creates a new blank target, attaches to it and enables the Page, Runtime and DOM domains.
     * If any step fails whatever was already created is torn down again.
     *
     * @throws AttachException if the target could not be created, attached or set up
     */
    public static Tab open(CDPClient cdp) {
        String targetId;
        try {
            targetId = cdp.domain(Target.class).createTarget("about:blank", null, true);
        } catch (CDPException e) {
            throw new AttachException(null, "Failed to create target: " + e.getMessage(), e);
        }
        var session = new CDPSession(cdp, targetId);
        try {
            session.attach();
            session.domain(Page.class).enable();
            session.domain(Runtime.class).enable();
            session.domain(DOM.class).enable();
        } catch (AttachException e) {
            session.close();
            throw e;
        } catch (RuntimeException e) {
            session.close();
            throw new AttachException(targetId, "Failed to enable domains: " + e.getMessage(), e);
        }
        log.debug("Opened tab {}", targetId);
        return new Tab(session);
    }

    public void navigateTo(String url) throws NavigationException, InterruptedException {
        navigateTo(url, NavigateOptions.DEFAULTS);
    }

    /**
     * Navigates and waits for the page's load (or DOMContentLoaded) event, then pauses for
     * {@link NavigateOptions#settle()}.
     *
     * @throws NavigationFailedException   if the browser reports the navigation failed
     * @throws NavigationTimedOutException if the event doesn't arrive within the timeout
     */
    public void navigateTo(String url, NavigateOptions options) throws NavigationException, InterruptedException {
        long start = System.nanoTime();
        String eventName = options.waitUntil().eventName();
        // registered before navigating so a fast load event can't slip past
        try (var loadEvent = session.expectEvent(Set.of(eventName))) {
            var navigate = page.navigate(url);
            if (navigate.errorText() != null) {
                throw new NavigationFailedException(url, navigate.errorText());
            }
            try {
                loadEvent.await(remaining(options.timeout(), start));
            } catch (CDPTimeoutException e) {
                throw new NavigationTimedOutException(url, eventName, Duration.ofNanos(System.nanoTime() - start));
            }
        }
        log.debug("Loaded {} in {} ms", url, (System.nanoTime() - start) / 1_000_000);
        pause(options.settle());
    }

    private static Duration remaining(Duration timeout, long startNanos) {
        Duration remaining = timeout.minusNanos(System.nanoTime() - startNanos);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public void waitForSelector(String selector) throws InterruptedException {
        waitForSelector(selector, WaitOptions.DEFAULTS);
    }

    /**
     * Polls until an element matching {@code selector} exists.
     *
     * @throws SelectorTimedOutException if none appears before the timeout
     */
    public void waitForSelector(String selector, WaitOptions options) throws InterruptedException {
        long start = System.nanoTime();
        if (!poll(Scripts.call(Scripts.EXISTS, selector), options)) {
            throw new SelectorTimedOutException(selector, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Polls until {@code expression} evaluates to a truthy value.
     *
     * @throws CDPTimeoutException if it doesn't before the timeout
     */
    public void waitForFunction(@Language("JavaScript") String expression, WaitOptions options)
            throws InterruptedException {
        long start = System.nanoTime();
        if (!poll(Scripts.truthy(expression), options)) {
            throw new CDPTimeoutException("Timed out waiting for " + expression,
                    Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private boolean poll(String booleanExpression, WaitOptions options) throws InterruptedException {
        long start = System.nanoTime();
        long timeoutNanos = options.timeout().toNanos();
        while (System.nanoTime() - start < timeoutNanos) {
            if (Boolean.TRUE.equals(evaluate(booleanExpression))) return true;
            Thread.sleep(options.interval().toMillis());
        }
        return false;
    }

    /**
     * Evaluates an expression in the page, waiting for it to settle if it returns a promise.
     *
     * @return the value as a String, Boolean, Number, List or Map, or null for undefined and null
     * @throws EvaluationException if the expression threw
     */
    @SuppressWarnings("unchecked")
    public <T> T evaluate(@Language("JavaScript") String expression) {
        var evaluate = runtime.evaluate(expression, true, true);
        if (evaluate.exceptionDetails() != null) {
            throw new EvaluationException(expression, evaluate.exceptionDetails().describe());
        }
        return evaluate.result() == null ? null : (T) evaluate.result().toJavaObject();
    }

    /**
     * Trimmed text content of the first element matching {@code selector}, or null if there's none.
     */
    public String getText(String selector) {
        return evaluate(Scripts.call(Scripts.GET_TEXT, selector));
    }

    public List<String> getTextAll(String selector) {
        return evaluate(Scripts.call(Scripts.GET_TEXT_ALL, selector));
    }

    public String getAttribute(String selector, String attribute) {
        return evaluate(Scripts.call(Scripts.GET_ATTRIBUTE, selector, attribute));
    }

    public boolean exists(String selector) {
        return Boolean.TRUE.equals(evaluate(Scripts.call(Scripts.EXISTS, selector)));
    }

    /**
     * Clicks the first element matching {@code selector}.
     *
     * @return false if there was no such element
     */
    public boolean click(String selector) {
        return Boolean.TRUE.equals(evaluate(Scripts.call(Scripts.CLICK, selector)));
    }

    /**
     * Sets the value of the first input matching {@code selector} and fires an input event.
     *
     * @return false if there was no such element
     */
    public boolean type(String selector, String text) {
        return Boolean.TRUE.equals(evaluate(Scripts.call(Scripts.TYPE, selector, text)));
    }

    public String content() {
        return evaluate(Scripts.CONTENT);
    }

    public String url() {
        return evaluate(Scripts.URL);
    }

    public String title() {
        return evaluate(Scripts.TITLE);
    }

    /**
     * Runs {@code source} in every document loaded into this tab from now on, before the page's own scripts.
     */
    public Page.ScriptIdentifier addInitScript(@Language("JavaScript") String source) {
        return page.addScriptToEvaluateOnNewDocument(source);
    }

    public void removeInitScript(Page.ScriptIdentifier identifier) {
        page.removeScriptToEvaluateOnNewDocument(identifier);
    }

    /**
     * Sleeps for {@code duration}, failing early if the tab is closed meanwhile.
     *
     * @throws org.postevent.cdp.protocol.NotAttachedException if the tab is or becomes closed
     */
    public void pause(Duration duration) throws InterruptedException {
        long deadline = System.nanoTime() + Math.max(0, duration.toNanos());
        session.checkOpen();
        for (long remaining; (remaining = deadline - System.nanoTime()) > 0; ) {
            TimeUnit.NANOSECONDS.sleep(Math.min(remaining, PAUSE_CHECK_INTERVAL.toNanos()));
            session.checkOpen();
        }
    }

    public boolean isAttached() {
        return session.isAttached();
    }

    public String targetId() {
        return session.targetId();
    }

    public CDPSession session() {
        return session;
    }

    /**
     * Detaches and closes the target. Never throws and may be called more than once.
     */
    @Override
    public void close() {
        session.close();
    }
}
