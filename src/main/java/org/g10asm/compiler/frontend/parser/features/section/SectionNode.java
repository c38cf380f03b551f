package org.g10asm.compiler.frontend.parser.features.section;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

/**
 * An AST node that switches the output section with <code>.rom</code> or <code>.ram</code>.
 *
 * @param directive The directive token.
 * @param section The selected section.
 */
public record SectionNode(
        Token directive,
        Section section
) implements AstNode {

    public enum Section {
        ROM,
        RAM
    }
}
