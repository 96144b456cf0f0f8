package com.solfmt.plugins.solidity.ast;

import java.io.IOException;
import java.util.List;

/** {@code import {A, B as C} from "path";} */
public final class RenamedImport extends ImportDirective {
    private final List<Symbol> symbols;

    public RenamedImport(Loc loc, String path, List<Symbol> symbols, List<Comment> detachedComments) {
        super(loc, path, detachedComments);
        this.symbols = List.copyOf(symbols);
    }

    /** Imported symbols in source order. */
    public List<Symbol> getSymbols() {
        return symbols;
    }

    @Override
    public void accept(NodeVisitor visitor) throws IOException {
        visitor.visit(this);
    }

    /** One {@code name[ as alias]} entry and the comments written after it. */
    public static final class Symbol {
        private final String name;
        private final String alias;
        private final List<Comment> comments;

        public Symbol(String name, String alias, List<Comment> comments) {
            this.name = name;
            this.alias = alias;
            this.comments = List.copyOf(comments);
        }

        public Symbol(String name, String alias) {
            this(name, alias, List.of());
        }

        public Symbol(String name) {
            this(name, null);
        }

        public String getName() {
            return name;
        }

        /** The local alias, or {@code null} if the symbol is not renamed. */
        public String getAlias() {
            return alias;
        }

        public List<Comment> getComments() {
            return comments;
        }

        @Override
        public String toString() {
            return alias == null ? name : name + " as " + alias;
        }
    }
}
