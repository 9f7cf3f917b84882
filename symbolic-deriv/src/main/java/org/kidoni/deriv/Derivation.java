package org.kidoni.deriv;

/**
 * An expression paired with its derivative, printed as {@code expr<TAB>:<TAB>derivative}.
 */
public class Derivation {
    private final Expr expression;
    private final Expr.Variable variable;
    private final Expr derivative;

    public static Derivation of(final Expr expression, final Expr.Variable variable, final Differentiator differentiator) {
        return new Derivation(expression, variable, differentiator.differentiate(expression, variable));
    }

    private Derivation(final Expr expression, final Expr.Variable variable, final Expr derivative) {
        this.expression = expression;
        this.variable = variable;
        this.derivative = derivative;
    }

    public Expr getExpression() {
        return expression;
    }

    public Expr.Variable getVariable() {
        return variable;
    }

    public Expr getDerivative() {
        return derivative;
    }

    @Override
    public String toString() {
        return Expr.display(expression) + "\t:\t" + Expr.display(derivative);
    }
}
