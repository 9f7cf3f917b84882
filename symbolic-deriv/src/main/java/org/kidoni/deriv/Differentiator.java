package org.kidoni.deriv;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Differentiates expression trees under a fixed {@link Rules} setting.
 */
public final class Differentiator {
    private static final Logger LOG = LoggerFactory.getLogger(Differentiator.class);

    private final Rules rules;

    public static Differentiator of(final Rules rules) {
        return new Differentiator(rules);
    }

    public static Differentiator reference() {
        return new Differentiator(Rules.REFERENCE);
    }

    private Differentiator(final Rules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public Rules getRules() {
        return rules;
    }

    public Expr differentiate(final Expr expr, final Expr.Variable wrt) {
        Objects.requireNonNull(expr, "expr");
        Objects.requireNonNull(wrt, "wrt");

        Expr derivative = expr.differentiate(wrt, rules);
        if (LOG.isDebugEnabled()) {
            LOG.debug("d/d{} {} = {} [{}]", wrt.name(), expr, derivative, rules);
        }
        return derivative;
    }
}
