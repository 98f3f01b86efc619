package org.csu.samplelang.common.exception;

import org.csu.samplelang.compiler.syntax.SyntaxToken;

/**
 * @description: 语法分析阶段的异常：意外的 Token、未闭合的块
 */
public class ParseException extends CompilationException {

    public ParseException(String message) {
        super(Stage.PARSE, message);
    }

    public ParseException(SyntaxToken token, String message) {
        super(Stage.PARSE, withPosition(message, token.getLine(), token.getColumn()));
    }
}
