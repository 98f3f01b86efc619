package org.csu.samplelang.common.exception;

/**
 * @description: 词法分析阶段的异常：未闭合的字符串、非法的标识符
 */
public class LexException extends CompilationException {

    public LexException(String message) {
        super(Stage.LEX, message);
    }

    public LexException(String message, int line, int column) {
        super(Stage.LEX, withPosition(message, line, column));
    }
}
