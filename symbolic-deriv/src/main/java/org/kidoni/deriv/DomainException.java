package org.kidoni.deriv;

/**
 * Thrown when an operation is undefined for its constant operand, e.g. {@code ln(0)}.
 */
public class DomainException extends ExpressionException {
    public DomainException(final String message) {
        super(message);
    }
}
