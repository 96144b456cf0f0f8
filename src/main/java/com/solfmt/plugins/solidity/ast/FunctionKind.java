package com.solfmt.plugins.solidity.ast;

import java.util.Arrays;
import java.util.Optional;

public enum FunctionKind {
    FUNCTION("function"),
    CONSTRUCTOR("constructor"),
    FALLBACK("fallback"),
    RECEIVE("receive"),
    MODIFIER("modifier");

    private final String keyword;

    FunctionKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static Optional<FunctionKind> forKeyword(String keyword) {
        return Arrays.stream(values())
                .filter(kind -> kind.keyword.equals(keyword))
                .findFirst();
    }
}
