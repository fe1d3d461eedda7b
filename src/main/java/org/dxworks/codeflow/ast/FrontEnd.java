package org.dxworks.codeflow.ast;

public interface FrontEnd {

    AstNode parse(String sourceCode) throws FrontEndException;
}
