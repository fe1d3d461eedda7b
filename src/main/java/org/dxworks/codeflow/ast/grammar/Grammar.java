package org.dxworks.codeflow.ast.grammar;

import org.dxworks.codeflow.Language;
import org.dxworks.codeflow.ast.NodeKind;

/**
 * Maps one tree-sitter grammar onto the language-neutral node model.
 */
public interface Grammar {

    NodeKind kindOf(String nodeType);

    /** Grammar field that holds {@code role} on nodes of {@code nodeType}. */
    String fieldFor(String nodeType, String role);

    TokenTable tokens();

    static Grammar of(Language language) {
        return switch (language) {
            case JAVA -> JavaGrammar.INSTANCE;
            case PYTHON -> PythonGrammar.INSTANCE;
        };
    }
}
