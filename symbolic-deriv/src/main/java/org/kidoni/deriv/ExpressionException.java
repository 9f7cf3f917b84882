package org.kidoni.deriv;

/**
 * Base of the failures raised while building or differentiating an expression.
 * Any of them aborts the whole call; no partial tree is returned.
 */
public abstract class ExpressionException extends RuntimeException {
    protected ExpressionException(final String message) {
        super(message);
    }
}
