package org.dxworks.codeflow.ast.grammar;

import static org.dxworks.codeflow.ast.NodeKind.*;

public final class PythonGrammar extends TableGrammar {

    public static final PythonGrammar INSTANCE = new PythonGrammar();

    private PythonGrammar() {
        super(TokenTable.PYTHON);
        kind(PROCEDURE, "function_definition");
        kind(CLASS, "class_definition");
        kind(DECORATED, "decorated_definition");
        kind(BLOCK, "block");
        kind(IF, "if_statement", "elif_clause");
        kind(ELSE, "else_clause");
        kind(WHILE, "while_statement");
        kind(FOR_EACH, "for_statement");
        kind(SWITCH, "match_statement");
        kind(CASE_ARM, "case_clause");
        kind(LABEL, "case_pattern", "if_clause");
        kind(RETURN, "return_statement");
        kind(THROW, "raise_statement");
        kind(BREAK, "break_statement");
        kind(CONTINUE, "continue_statement");
        kind(ASSIGNMENT, "assignment", "augmented_assignment");
        kind(EXPRESSION, "expression_statement");
        kind(IDENTIFIER, "identifier");
        kind(STRING_LITERAL, "string", "concatenated_string");
        kind(COMMENT, "comment");

        alias("for_statement", "target", "left");
        alias("for_statement", "iterable", "right");
        alias("match_statement", "condition", "subject");
    }
}
