package org.csu.samplelang.common.exception;

/**
 * @description: 代码生成阶段的异常，遇到没有生成规则的节点种类时抛出
 */
public class EmitException extends CompilationException {

    public EmitException(String message) {
        super(Stage.EMIT, message);
    }
}
