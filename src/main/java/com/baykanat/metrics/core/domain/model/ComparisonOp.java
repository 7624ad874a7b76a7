package com.baykanat.metrics.core.domain.model;

import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

/** Threshold ve attribute kurallarındaki karşılaştırma operatörü; Java ve SQL karşılığı. */
public enum ComparisonOp {
    GTE(">=", ">="),
    GT(">", ">"),
    LTE("<=", "<="),
    LT("<", "<"),
    EQ("==", "="),
    NE("!=", "<>");

    private final String symbol;
    private final String sqlOperator;

    ComparisonOp(String symbol, String sqlOperator) {
        this.symbol = symbol;
        this.sqlOperator = sqlOperator;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    public String sqlOperator() {
        return sqlOperator;
    }

    public boolean isEquality() {
        return this == EQ || this == NE;
    }

    /** BigDecimal karşılaştırması compareTo ile; scale farkı (10 vs 10.0000) eşitliği bozmaz. */
    public boolean test(BigDecimal left, BigDecimal right) {
        int cmp = left.compareTo(right);
        return switch (this) {
            case GTE -> cmp >= 0;
            case GT -> cmp > 0;
            case LTE -> cmp <= 0;
            case LT -> cmp < 0;
            case EQ -> cmp == 0;
            case NE -> cmp != 0;
        };
    }

    @JsonCreator
    public static ComparisonOp fromSymbol(String raw) {
        if (raw != null) {
            for (ComparisonOp op : values()) {
                if (op.symbol.equals(raw.trim())) {
                    return op;
                }
            }
        }
        throw new MetricsValidationException("Invalid op: " + raw);
    }
}
