package org.csu.samplelang.common.exception;

import lombok.Getter;

/**
 * @description: 编译流水线中所有错误的基类
 *
 * 每个异常都带有出错的阶段；任何阶段出错都会中止整个编译，不做恢复。
 */
@Getter
public abstract class CompilationException extends RuntimeException {

    /**
     * 出错的编译阶段，label 用于 toString() 的前缀。
     */
    @Getter
    public enum Stage {
        LEX("Lexical Error"),
        PARSE("Syntax Error"),
        EMIT("Emitter Error");

        private final String label;

        Stage(String label) {
            this.label = label;
        }
    }

    private final Stage stage;

    protected CompilationException(Stage stage, String message) {
        super(message);
        this.stage = stage;
    }

    static String withPosition(String message, int line, int column) {
        return String.format("%s (line %d, column %d)", message, line, column);
    }

    @Override
    public String toString() {
        return stage.getLabel() + ": " + getMessage();
    }
}
