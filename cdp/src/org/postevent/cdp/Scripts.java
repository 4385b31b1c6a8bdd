package org.postevent.cdp;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.intellij.lang.annotations.Language;
import org.postevent.cdp.protocol.RPC;

import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Builds the expressions evaluated by {@link Tab}. Values from callers are never spliced into
 * script source directly: they become arguments of an immediately invoked function, each encoded
 * by {@link #literal(Object)}.
 */
public final class Scripts {
    static final String EXISTS = "(selector) => !!document.querySelector(selector)";
    static final String GET_TEXT = """
            (selector) => {
                const el = document.querySelector(selector);
                return el ? el.textContent.trim() : null;
            }""";
    static final String GET_TEXT_ALL = """
            (selector) => Array.from(document.querySelectorAll(selector), el => el.textContent.trim())""";
    static final String GET_ATTRIBUTE = """
            (selector, name) => {
                const el = document.querySelector(selector);
                return el ? el.getAttribute(name) : null;
            }""";
    static final String CLICK = """
            (selector) => {
                const el = document.querySelector(selector);
                if (el) el.click();
                return !!el;
            }""";
    static final String TYPE = """
            (selector, text) => {
                const el = document.querySelector(selector);
                if (el) {
                    el.value = text;
                    el.dispatchEvent(new Event('input', { bubbles: true }));
                }
                return !!el;
            }""";
    static final String CONTENT = "document.documentElement.outerHTML";
    static final String URL = "window.location.href";
    static final String TITLE = "document.title";

    private static final String LINE_SEPARATOR = String.valueOf((char) 0x2028);
    private static final String PARAGRAPH_SEPARATOR = String.valueOf((char) 0x2029);

    private Scripts() {
    }

    /**
     * Encodes a value as a JavaScript literal. Strings become double-quoted literals with quotes,
     * backslashes and control characters escaped; U+2028 and U+2029, legal in JSON but line
     * terminators in older JavaScript engines, are escaped as well. Numbers, booleans, null, lists
     * and maps are encoded as their JSON form.
     */
    public static String literal(Object value) {
        try {
            return RPC.JSON.writeValueAsString(value)
                    .replace(LINE_SEPARATOR, "\\u2028")
                    .replace(PARAGRAPH_SEPARATOR, "\\u2029");
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Builds an expression that calls {@code function} with the given arguments.
     */
    public static String call(@Language("JavaScript") String function, Object... args) {
        return "(" + function + ")(" + Arrays.stream(args).map(Scripts::literal)
                .collect(Collectors.joining(", ")) + ")";
    }

    /**
     * Wraps an expression so that it evaluates to its truthiness.
     */
    static String truthy(@Language("JavaScript") String expression) {
        return "!!(" + expression + ")";
    }
}
