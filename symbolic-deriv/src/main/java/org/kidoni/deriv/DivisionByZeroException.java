package org.kidoni.deriv;

public class DivisionByZeroException extends ExpressionException {
    public DivisionByZeroException() {
        super("math error: attempted to divide by zero");
    }
}
