package org.kidoni.deriv;

/**
 * Thrown when no differentiation rule matches the shape of a node.
 */
public class UnsupportedDerivativeException extends ExpressionException {
    private final transient Expr expression;

    public UnsupportedDerivativeException(final Expr expression) {
        super("no derivative rule for " + expression);
        this.expression = expression;
    }

    public Expr getExpression() {
        return expression;
    }
}
