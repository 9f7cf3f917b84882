package org.kidoni.deriv;

import java.util.Locale;

/**
 * Selects how {@code Sub} and {@code Div} nodes combine the derivatives of their operands.
 */
public enum Rules {
    /**
     * Matches the historical output: the difference of derivatives is combined with addition,
     * and the quotient numerator is {@code l*r' - r'*l}.
     */
    REFERENCE,

    /**
     * Textbook rules: {@code (l - r)' = l' - r'} and {@code (l / r)' = (l'*r - l*r') / r^2}.
     */
    CORRECTED;

    public static Rules fromName(final String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("rules name missing");
        }

        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown rules: " + name, e);
        }
    }
}
