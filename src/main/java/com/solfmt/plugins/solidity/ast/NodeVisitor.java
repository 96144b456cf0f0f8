package com.solfmt.plugins.solidity.ast;

import java.io.IOException;

/**
 * A visitor over the closed set of Solidity syntax nodes.
 *
 * <p>There is one overload per concrete node class and no default implementations, so adding a
 * node kind forces every visitor to handle it. Visits may fail with an {@link IOException} when
 * the visitor writes output.
 */
public interface NodeVisitor {

    void visit(SourceUnit unit) throws IOException;

    void visit(PragmaDirective pragma) throws IOException;

    void visit(PlainImport plainImport) throws IOException;

    void visit(AliasedImport aliasedImport) throws IOException;

    void visit(RenamedImport renamedImport) throws IOException;

    void visit(ContractDefinition contract) throws IOException;

    void visit(InheritanceSpecifier base) throws IOException;

    void visit(EnumDefinition enumeration) throws IOException;

    void visit(FunctionDefinition function) throws IOException;

    void visit(Block block) throws IOException;

    void visit(VariableDefinition variable) throws IOException;

    void visit(OpaqueDefinition definition) throws IOException;

    void visit(DocComment docComment) throws IOException;

    void visit(Comment comment) throws IOException;
}
