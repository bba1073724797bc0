package org.deduction.symbolic;

import java.util.Locale;
import java.util.Optional;

/**
 * 可选的可满足性后端。
 */
public enum SatBackendKind {
    DPLL("dpll"),
    Z3("z3");

    private final String label;

    SatBackendKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<SatBackendKind> fromLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String key = text.trim().toLowerCase(Locale.ROOT);
        for (SatBackendKind kind : values()) {
            if (kind.label.equals(key)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
