package org.pragmatica.veq.tree;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.Arrays;
import java.util.Optional;

/**
 * Single-argument functions callable as {@code name(expr)}.
 */
public enum MathFunction {
    SIN("sin"),
    COS("cos"),
    TAN("tan"),
    ASIN("asin"),
    ACOS("acos"),
    ATAN("atan"),
    SINH("sinh"),
    COSH("cosh"),
    TANH("tanh"),
    ASINH("asinh"),
    ACOSH("acosh"),
    ATANH("atanh"),
    RAD("rad"),
    DEG("deg"),
    LOG("log"),
    ABS("abs"),
    ROUND("round"),
    SIGN("sign");

    private static final ImmutableMap<String, MathFunction> BY_NAME =
        Maps.uniqueIndex(Arrays.asList(values()), MathFunction::keyword);

    private final String keyword;

    MathFunction(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<MathFunction> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
