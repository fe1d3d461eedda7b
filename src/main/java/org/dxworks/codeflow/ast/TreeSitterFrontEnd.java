package org.dxworks.codeflow.ast;

import org.dxworks.codeflow.Language;
import org.dxworks.codeflow.ast.grammar.Grammar;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJava;
import org.treesitter.TreeSitterPython;

public class TreeSitterFrontEnd implements FrontEnd {

    private final Language language;
    private final boolean rejectSyntaxErrors;

    public TreeSitterFrontEnd(Language language, boolean rejectSyntaxErrors) {
        this.language = language;
        this.rejectSyntaxErrors = rejectSyntaxErrors;
    }

    @Override
    public AstNode parse(String sourceCode) throws FrontEndException {
        TSNode rootNode;
        try {
            TSParser parser = new TSParser();
            parser.setLanguage(treeSitterLanguage(language));
            TSTree tree = parser.parseString(null, sourceCode);
            rootNode = tree.getRootNode();
        } catch (LinkageError e) {
            throw new FrontEndException("Tree-sitter is unavailable for " + language.getName() + ": " + e, e);
        }

        if (rejectSyntaxErrors && rootNode.hasError()) {
            throw new FrontEndException("Syntax errors in " + language.getName() + " source");
        }
        return new TreeSitterAstNode(rootNode, new SourceText(sourceCode), Grammar.of(language));
    }

    private static TSLanguage treeSitterLanguage(Language language) {
        return switch (language) {
            case JAVA -> new TreeSitterJava();
            case PYTHON -> new TreeSitterPython();
        };
    }
}
