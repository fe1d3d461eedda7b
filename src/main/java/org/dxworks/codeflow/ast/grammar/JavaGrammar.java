package org.dxworks.codeflow.ast.grammar;

import static org.dxworks.codeflow.ast.NodeKind.*;

public final class JavaGrammar extends TableGrammar {

    public static final JavaGrammar INSTANCE = new JavaGrammar();

    private JavaGrammar() {
        super(TokenTable.JAVA);
        kind(PROCEDURE, "method_declaration", "constructor_declaration", "compact_constructor_declaration");
        kind(CLASS, "class_declaration", "interface_declaration", "enum_declaration", "record_declaration");
        kind(BLOCK, "block", "constructor_body");
        kind(IF, "if_statement");
        kind(WHILE, "while_statement");
        kind(FOR, "for_statement");
        kind(FOR_EACH, "enhanced_for_statement");
        kind(SWITCH, "switch_expression", "switch_statement");
        kind(CASE, "switch_block_statement_group");
        kind(CASE_ARM, "switch_rule");
        kind(LABEL, "switch_label");
        kind(RETURN, "return_statement");
        kind(THROW, "throw_statement");
        kind(BREAK, "break_statement");
        kind(CONTINUE, "continue_statement");
        kind(LABELED, "labeled_statement");
        kind(DECLARATION, "local_variable_declaration");
        kind(DECLARATOR, "variable_declarator");
        kind(ASSIGNMENT, "assignment_expression");
        kind(UPDATE, "update_expression");
        kind(EXPRESSION, "expression_statement");
        kind(IDENTIFIER, "identifier");
        kind(STRING_LITERAL, "string_literal", "character_literal", "text_block");
        kind(COMMENT, "line_comment", "block_comment");

        alias("enhanced_for_statement", "target", "name");
        alias("enhanced_for_statement", "iterable", "value");
    }
}
