package com.solfmt.plugins.solidity.ast;

import java.io.IOException;
import java.util.List;

/**
 * A function-like definition: function, constructor, fallback, receive or modifier.
 *
 * <p>The signature (keyword through the last token before the body or {@code ;}) and the body
 * are kept as source ranges and reproduced verbatim. Comments between the signature and the body
 * or {@code ;} are detached.
 */
public final class FunctionDefinition extends Declaration implements ContractPart {
    private final FunctionKind kind;
    private final Loc signature;
    private final Block body;

    public FunctionDefinition(Loc loc, List<DocComment> docs, List<Comment> detachedComments, FunctionKind kind,
                              Loc signature, Block body) {
        super(loc, docs, detachedComments);
        this.kind = kind;
        this.signature = signature;
        this.body = body;
    }

    public FunctionDefinition(Loc loc, List<DocComment> docs, FunctionKind kind, Loc signature, Block body) {
        this(loc, docs, List.of(), kind, signature, body);
    }

    public FunctionKind getKind() {
        return kind;
    }

    public Loc getSignature() {
        return signature;
    }

    /** The body, or {@code null} for a declaration terminated by {@code ;}. */
    public Block getBody() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    @Override
    public void accept(NodeVisitor visitor) throws IOException {
        visitor.visit(this);
    }
}
