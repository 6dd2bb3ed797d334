package com.audiencemanager.domain.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Comparison operators accepted in rule conditions.
 *
 * <p>Conditions carry the operator as its SQL symbol ({@code ">="}, {@code "NOT IN"}, ...),
 * so lookup is by symbol rather than by enum name. {@link #BETWEEN} reads its upper bound
 * from {@code value2}; {@link #IN} and {@link #NOT_IN} expect a non-empty list.
 */
@Getter
@RequiredArgsConstructor
public enum ConditionOperator {
    GT(">"),
    LT("<"),
    EQ("="),
    GTE(">="),
    LTE("<="),
    NEQ("!="),
    IN("IN"),
    NOT_IN("NOT IN"),
    BETWEEN("BETWEEN");

    private final String symbol;

    public boolean isListOperator() {
        return this == IN || this == NOT_IN;
    }

    /** Resolves an operator from its symbol, case and inner whitespace insensitive. */
    public static Optional<ConditionOperator> fromSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return Optional.empty();
        }
        String normalized = symbol.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        if (normalized.equals("<>") || normalized.equals("==")) {
            normalized = normalized.equals("<>") ? "!=" : "=";
        }
        String target = normalized;
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(target))
                .findFirst();
    }
}
