package org.postevent.cdp;

/**
 * The evaluated script threw. The message is the description of the thrown value.
 */
public class EvaluationException extends RuntimeException {
    private final String expression;

    public EvaluationException(String expression, String description) {
        super("Evaluation failed: " + description);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
