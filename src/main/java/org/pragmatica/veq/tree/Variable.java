package org.pragmatica.veq.tree;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.Arrays;
import java.util.Optional;

/**
 * Runtime variables of an equation. Values are supplied per evaluation call.
 */
public enum Variable {
    X("x"),
    T("t");

    private static final ImmutableMap<String, Variable> BY_NAME =
        Maps.uniqueIndex(Arrays.asList(values()), Variable::keyword);

    private final String keyword;

    Variable(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<Variable> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
