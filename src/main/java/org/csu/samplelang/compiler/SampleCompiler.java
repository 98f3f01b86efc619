package org.csu.samplelang.compiler;

import lombok.Getter;
import org.csu.samplelang.common.exception.CompilationException;
import org.csu.samplelang.compiler.emitter.Emitter;
import org.csu.samplelang.compiler.lexer.Lexer;
import org.csu.samplelang.compiler.parser.Parser;
import org.csu.samplelang.compiler.parser.ast.statement.ProgramNode;
import org.csu.samplelang.compiler.syntax.SyntaxToken;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * @description: 编译器入口
 *
 * 依次执行 词法分析 -> 语法分析 -> 代码生成。全有或全无：任何阶段出错都直接抛出
 * 带阶段标记的 {@link CompilationException}，之前阶段的产物全部丢弃。
 */
public class SampleCompiler {

    private static final Logger LOGGER = Logger.getLogger(SampleCompiler.class.getName());

    @Getter
    private final CompilerOptions options;
    private final Emitter emitter;

    public SampleCompiler() {
        this(CompilerOptions.defaults());
    }

    public SampleCompiler(CompilerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.emitter = new Emitter(options.getIndent());
    }

    /**
     * 编译源代码，返回 Token 序列、语法树和生成的代码。
     */
    public CompilationResult compile(String source) {
        long start = System.nanoTime();
        try {
            Lexer lexer = new Lexer(source, options.getKeywords());
            List<SyntaxToken> tokens = lexer.tokenize();
            ProgramNode program = new Parser(lexer).parse();
            String output = emitter.emit(program);
            LOGGER.fine(() -> String.format("Compiled program '%s': %d tokens, %d output chars in %.2f ms",
                    program.getName(), tokens.size(), output.length(), (System.nanoTime() - start) / 1e6));
            return new CompilationResult(tokens, program, output);
        } catch (CompilationException e) {
            LOGGER.log(Level.FINE, "Compilation failed in stage " + e.getStage(), e);
            throw e;
        }
    }

    /**
     * 只要生成的代码
     */
    public String translate(String source) {
        return compile(source).output();
    }
}
