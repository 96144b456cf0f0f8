package com.solfmt.plugins.solidity.ast;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public final class EnumDefinition extends Declaration implements ContractPart {
    private final String name;
    private final List<String> values;
    private final List<List<Comment>> valueComments;

    /**
     * @param valueComments for each value, the comments written after it; same size as
     *     {@code values}
     */
    public EnumDefinition(Loc loc, List<DocComment> docs, List<Comment> detachedComments, String name,
                          List<String> values, List<List<Comment>> valueComments) {
        super(loc, docs, detachedComments);
        if (valueComments.size() != values.size()) {
            throw new IllegalArgumentException(
                    "Expected comments for " + values.size() + " values, got " + valueComments.size());
        }
        this.name = name;
        this.values = List.copyOf(values);
        List<List<Comment>> copies = new ArrayList<>();
        for (List<Comment> comments : valueComments) {
            copies.add(List.copyOf(comments));
        }
        this.valueComments = List.copyOf(copies);
    }

    public String getName() {
        return name;
    }

    public List<String> getValues() {
        return values;
    }

    /** The comments written after the value at {@code index}. */
    public List<Comment> getCommentsAfter(int index) {
        return valueComments.get(index);
    }

    @Override
    public void accept(NodeVisitor visitor) throws IOException {
        visitor.visit(this);
    }
}
