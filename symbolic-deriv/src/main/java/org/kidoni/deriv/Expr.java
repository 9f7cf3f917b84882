package org.kidoni.deriv;

/**
 * An immutable algebraic expression tree.
 * <p>
 * Build operator nodes only through their {@code create} factories. The record constructors are
 * public, as every interface member is, but they skip simplification, so a tree built with them
 * may hold reducible patterns that the rest of this package never produces.
 * <p>
 * The factories apply local algebraic identities before allocating a node:
 * <pre>
 *  Add:  0 + r -> r,  l + 0 -> l
 *  Sub:  l - 0 -> l
 *  Mul:  0 * r -> 0,  1 * r -> r,  l * 0 -> 0,  l * 1 -> l
 *  Pow:  b ^ 0 -> 1,  b ^ 1 -> b         (b not constant)
 *  Div:  l / 0 -> error,  l / 1 -> l,  0 / r -> 0
 *  Ln:   ln(0) -> error,  ln(e) -> 1
 * </pre>
 * Two constant operands are never folded by a factory. Simplification is local: a pattern
 * created one level up is not revisited.
 */
public sealed interface Expr permits Expr.Constant, Expr.Variable, Expr.Add, Expr.Sub, Expr.Mul, Expr.Div, Expr.Pow, Expr.Ln {
    double E = 2.718281828459045;

    static Constant constant(final double value) {
        return new Constant(value);
    }

    static Variable variable(final String name) {
        return new Variable(name);
    }

    static String display(final Expr expr) {
        StringBuilder sink = new StringBuilder();
        expr.display(sink);
        return sink.toString();
    }

    default boolean isConstant() {
        return false;
    }

    default Expr differentiate(final Variable wrt) {
        return differentiate(wrt, Rules.REFERENCE);
    }

    Expr differentiate(Variable wrt, Rules rules);

    void display(StringBuilder sink);

    private static boolean isConstantValue(final Expr expr, final double value) {
        return expr instanceof Constant c && c.value() == value;
    }

    private static void displayBinary(final StringBuilder sink, final Expr lhs, final String op, final Expr rhs) {
        sink.append('(');
        lhs.display(sink);
        sink.append(' ').append(op).append(' ');
        rhs.display(sink);
        sink.append(')');
    }

    record Constant(double value) implements Expr {
        @Override
        public boolean isConstant() {
            return true;
        }

        public boolean isConstantE() {
            return Math.abs(value - E) < 1e-10;
        }

        @Override
        public Expr differentiate(final Variable wrt, final Rules rules) {
            return new Constant(0);
        }

        @Override
        public void display(final StringBuilder sink) {
            // integral values print without a fraction: 345, not 345.0
            if (value == Math.rint(value) && Math.abs(value) < 1e15) {
                sink.append((long) value);
            }
            else {
                sink.append(value);
            }
        }

        @Override
        public String toString() {
            return Expr.display(this);
        }
    }

    record Variable(String name) implements Expr {
        public Variable {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("variable name missing");
            }
        }

        @Override
        public Expr differentiate(final Variable wrt, final Rules rules) {
            // any other variable is independent of wrt
            return name.equals(wrt.name()) ? new Constant(1) : new Constant(0);
        }

        @Override
        public void display(final StringBuilder sink) {
            sink.append(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Add(Expr lhs, Expr rhs) implements Expr {
        public static Expr create(final Expr lhs, final Expr rhs) {
            if (isConstantValue(lhs, 0)) {
                return rhs;
            }
            if (isConstantValue(rhs, 0)) {
                return lhs;
            }
            return new Add(lhs, rhs);
        }

        @Override
        public Expr differentiate(final Variable wrt, final Rules rules) {
            Expr lhsD = lhs.differentiate(wrt, rules);
            Expr rhsD = rhs.differentiate(wrt, rules);

            if (lhsD instanceof Constant l && rhsD instanceof Constant r) {
                return new Constant(l.value() + r.value());
            }

            return create(lhsD, rhsD);
        }

        @Override
        public void display(final StringBuilder sink) {
            displayBinary(sink, lhs, "+", rhs);
        }

        @Override
        public String toString() {
            return Expr.display(this);
        }
    }

    record Sub(Expr lhs, Expr rhs) implements Expr {
        public static Expr create(final Expr lhs, final Expr rhs) {
            if (isConstantValue(rhs, 0)) {
                return lhs;
            }
            return new Sub(lhs, rhs);
        }

        @Override
        public Expr differentiate(final Variable wrt, final Rules rules) {
            Expr lhsD = lhs.differentiate(wrt, rules);
            Expr rhsD = rhs.differentiate(wrt, rules);

            if (lhsD instanceof Constant l && rhsD instanceof Constant r) {
                return new Constant(l.value() - r.value());
            }

            return switch (rules) {
                case REFERENCE -> Add.create(lhsD, rhsD);
                case CORRECTED -> create(lhsD, rhsD);
            };
        }

        @Override
        public void display(final StringBuilder sink) {
            displayBinary(sink, lhs, "-", rhs);
        }

        @Override
        public String toString() {
            return Expr.display(this);
        }
    }

    record Mul(Expr lhs, Expr rhs) implements Expr {
        public static Expr create(final Expr lhs, final Expr rhs) {
            if (isConstantValue(lhs, 0)) {
                return new Constant(0);
            }
            if (isConstantValue(lhs, 1)) {
                return rhs;
            }
            if (isConstantValue(rhs, 0)) {
                return new Constant(0);
            }
            if (isConstantValue(rhs, 1)) {
                return lhs;
            }
            return new Mul(lhs, rhs);
        }

        @Override
        public Expr differentiate(final Variable wrt, final Rules rules) {
            Expr lhsD = lhs.differentiate(wrt, rules);
            Expr rhsD = rhs.differentiate(wrt, rules);

            return Add.create(create(lhs, rhsD), create(lhsD, rhs));
        }

        @Override
        public void display(final StringBuilder sink) {
            displayBinary(sink, lhs, "*", rhs);
        }

        @Override
        public String toString() {
            return Expr.display(this);
        }
    }

    record Div(Expr lhs, Expr rhs) implements Expr {
        public static Expr create(final Expr lhs, final Expr rhs) {
            if (isConstantValue(rhs, 0)) {
                throw new DivisionByZeroException();
            }
            if (isConstantValue(rhs, 1)) {
                return lhs;
            }
            if (isConstantValue(lhs, 0)) {
                return new Constant(0);
            }
            return new Div(lhs, rhs);
        }

        @Override
        public Expr differentiate(final Variable wrt, final Rules rules) {
            Expr lhsD = lhs.differentiate(wrt, rules);
            Expr rhsD = rhs.differentiate(wrt, rules);

            Expr numerator = switch (rules) {
                case REFERENCE -> Sub.create(Mul.create(lhs, rhsD), Mul.create(rhsD, lhs));
                case CORRECTED -> Sub.create(Mul.create(lhsD, rhs), Mul.create(lhs, rhsD));
            };

            return create(numerator, Pow.create(rhs, new Constant(2)));
        }

        @Override
        public void display(final StringBuilder sink) {
            displayBinary(sink, lhs, "/", rhs);
        }

        @Override
        public String toString() {
            return Expr.display(this);
        }
    }

    record Pow(Expr base, Expr exponent) implements Expr {
        public static Expr create(final Expr base, final Expr exponent) {
            if (!base.isConstant() && exponent instanceof Constant n) {
                if (n.value() == 0) {
                    return new Constant(1);
                }
                if (n.value() == 1) {
                    return base;
                }
            }
            return new Pow(base, exponent);
        }

        @Override
        public Expr differentiate(final Variable wrt, final Rules rules) {
            if (!base.isConstant() && exponent instanceof Constant n) {
                Expr power = Mul.create(exponent, create(base, new Constant(n.value() - 1)));
                return Mul.create(power, base.differentiate(wrt, rules));
            }
            if (base instanceof Constant a && !exponent.isConstant()) {
                Expr growth = Mul.create(create(a, exponent), Ln.create(a));
                return Mul.create(growth, exponent.differentiate(wrt, rules));
            }

            throw new UnsupportedDerivativeException(this);
        }

        @Override
        public void display(final StringBuilder sink) {
            displayBinary(sink, base, "^", exponent);
        }

        @Override
        public String toString() {
            return Expr.display(this);
        }
    }

    record Ln(Expr operand) implements Expr {
        public static Expr create(final Expr operand) {
            if (operand instanceof Constant c) {
                if (c.value() == 0) {
                    throw new DomainException("math error: argument of ln is zero");
                }
                if (c.isConstantE()) {
                    return new Constant(1);
                }
            }
            return new Ln(operand);
        }

        @Override
        public Expr differentiate(final Variable wrt, final Rules rules) {
            return Mul.create(Div.create(new Constant(1), operand), operand.differentiate(wrt, rules));
        }

        @Override
        public void display(final StringBuilder sink) {
            sink.append(" ln(");
            operand.display(sink);
            sink.append(')');
        }

        @Override
        public String toString() {
            return Expr.display(this);
        }
    }
}
