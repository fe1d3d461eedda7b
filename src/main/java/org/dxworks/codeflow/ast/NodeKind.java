package org.dxworks.codeflow.ast;

/**
 * Language-neutral classification of syntax nodes.
 * <p>
 * The CFG builder and the variable extractor dispatch exhaustively on this enum; grammar node
 * types with no dedicated handling map to {@link #OTHER}.
 */
public enum NodeKind {
    PROCEDURE,
    CLASS,
    /** A decorated definition whose {@code definition} child is the procedure or class. */
    DECORATED,
    BLOCK,
    IF,
    /** An explicit else clause wrapping a {@code body}. */
    ELSE,
    WHILE,
    FOR,
    FOR_EACH,
    SWITCH,
    /** A case group whose statements may fall through into the next group. */
    CASE,
    /** A case arm that never falls through. */
    CASE_ARM,
    LABEL,
    RETURN,
    THROW,
    BREAK,
    CONTINUE,
    /** A statement carrying a jump label; the labelled statement is its last named child. */
    LABELED,
    DECLARATION,
    DECLARATOR,
    ASSIGNMENT,
    UPDATE,
    EXPRESSION,
    IDENTIFIER,
    STRING_LITERAL,
    COMMENT,
    /** One source line produced by the degraded line front end. */
    LINE,
    OTHER
}
