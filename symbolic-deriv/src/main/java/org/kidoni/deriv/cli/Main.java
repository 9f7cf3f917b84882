package org.kidoni.deriv.cli;

import java.io.PrintStream;
import java.util.List;

import org.kidoni.deriv.Derivation;
import org.kidoni.deriv.Differentiator;
import org.kidoni.deriv.Expr;
import org.kidoni.deriv.ExpressionException;
import org.kidoni.deriv.Rules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.kidoni.deriv.Expr.constant;
import static org.kidoni.deriv.Expr.variable;

/**
 * Prints a few sample expressions next to their derivatives.
 * <p>
 * Settings come from a system property, then the environment, then a default:
 * <pre>
 *  deriv.variable / DERIV_VARIABLE   variable to differentiate by (x)
 *  deriv.rules    / DERIV_RULES      reference | corrected (reference)
 * </pre>
 */
public class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private static final String DEFAULT_VARIABLE = "x";
    private static final String DEFAULT_RULES = "reference";

    public static void main(String[] args) {
        System.exit(run(System.out));
    }

    static int run(final PrintStream out) {
        try {
            final Expr.Variable wrt = variable(setting("deriv.variable", "DERIV_VARIABLE", DEFAULT_VARIABLE));
            final Differentiator differentiator = Differentiator.of(Rules.fromName(setting("deriv.rules", "DERIV_RULES", DEFAULT_RULES)));

            for (Expr sample : samples(wrt)) {
                out.println(Derivation.of(sample, wrt, differentiator));
            }
        }
        catch (ExpressionException e) {
            LOG.error("differentiation failed: {}", e.getMessage(), e);
            return 1;
        }
        catch (IllegalArgumentException e) {
            LOG.error("invalid setting: {}", e.getMessage());
            return 1;
        }

        return 0;
    }

    static List<Expr> samples(final Expr.Variable x) {
        final Expr c69 = constant(69);
        final Expr c420 = constant(420);
        final Expr c5 = constant(5);
        final Expr e = constant(Expr.E);

        return List.of(
                Expr.Add.create(Expr.Mul.create(c5, Expr.Pow.create(x, c69)),
                        Expr.Mul.create(c5, Expr.Pow.create(x, c420))),
                Expr.Pow.create(c5, Expr.Mul.create(c69, x)),
                Expr.Pow.create(e, Expr.Mul.create(c69, x)));
    }

    static String setting(final String property, final String env, final String defaultValue) {
        String value = System.getProperty(property);
        if (value == null) {
            value = System.getenv(env);
        }
        return value != null ? value : defaultValue;
    }
}
