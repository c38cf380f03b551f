package org.g10asm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of the AST: all statements of a translation unit in source order.
 *
 * @param statements The top-level statements.
 */
public record ModuleNode(List<AstNode> statements) implements AstNode {

    public ModuleNode {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return statements;
    }
}
