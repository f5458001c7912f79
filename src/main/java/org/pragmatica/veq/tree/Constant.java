package org.pragmatica.veq.tree;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named constants. The parser replaces them with {@link Node.Literal} nodes,
 * so they never appear in an evaluated tree.
 */
public enum Constant {
    PI("pi", Math.PI),
    E("e", Math.E),
    G("g", 9.81);

    private static final ImmutableMap<String, Constant> BY_NAME =
        Maps.uniqueIndex(Arrays.asList(values()), Constant::keyword);

    private final String keyword;
    private final double value;

    Constant(String keyword, double value) {
        this.keyword = keyword;
        this.value = value;
    }

    public String keyword() {
        return keyword;
    }

    public double value() {
        return value;
    }

    public static Optional<Constant> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
