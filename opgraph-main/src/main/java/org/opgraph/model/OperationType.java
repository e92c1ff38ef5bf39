package org.opgraph.model;

import java.util.Map;

/**
 * Arithmetic operation kinds. The code is the stable numeric value used by
 * storage and transport layers; 0 is reserved for "unspecified".
 */
public enum OperationType {
    ADDITION(1, "+"),
    SUBTRACTION(2, "-"),
    MULTIPLICATION(3, "*"),
    DIVISION(4, "/");

    private static final Map<String, OperationType> BY_SYMBOL = Map.of(
            "+", ADDITION,
            "-", SUBTRACTION,
            "*", MULTIPLICATION,
            "/", DIVISION
    );

    private final int code;
    private final String symbol;

    OperationType(int code, String symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    public int code() {
        return code;
    }

    public String symbol() {
        return symbol;
    }

    public static OperationType fromSymbol(String symbol) {
        OperationType type = BY_SYMBOL.get(symbol);
        if (type == null) {
            throw new IllegalArgumentException("Unknown operation symbol: " + symbol);
        }
        return type;
    }

    public static OperationType fromCode(int code) {
        for (OperationType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown operation code: " + code);
    }
}
