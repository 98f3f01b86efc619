package org.csu.samplelang.cli;

import org.csu.samplelang.cli.tool.ConsoleLogging;
import org.csu.samplelang.cli.tool.SyntaxTreePrinter;
import org.csu.samplelang.cli.tool.TokenListingFormatter;
import org.csu.samplelang.common.exception.CompilationException;
import org.csu.samplelang.compiler.CompilationResult;
import org.csu.samplelang.compiler.CompilerOptions;
import org.csu.samplelang.compiler.SampleCompiler;
import org.csu.samplelang.compiler.lexer.KeywordTable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * @description: Sample 语言的命令行编译器
 *
 * 带文件参数时逐个编译并输出生成的 JavaScript；不带文件参数时进入交互模式，
 * 输入的行会一直累积到花括号配平为止，然后编译。
 */
public class SampleShell {

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join("\n",
            "Usage: samplec [options] [file...]",
            "  --tokens            print the token listing",
            "  --tree              print the syntax tree",
            "  --indent=<n>        indent generated code with n spaces instead of a tab",
            "  --keywords=<file>   load the keyword table from a properties file",
            "  --verbose           log compiler stages to stderr",
            "  --help              show this help",
            "Without files an interactive session is started; type 'exit' to quit.");

    private final PrintStream out;
    private final PrintStream err;

    private boolean showTokens;
    private boolean showTree;
    private boolean verbose;
    private CompilerOptions options = CompilerOptions.defaults();

    public SampleShell(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int status = new SampleShell(System.out, System.err).run(args, System.in);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * @return 进程退出码
     */
    public int run(String[] args, InputStream in) {
        List<Path> files = new ArrayList<>();
        for (String arg : args) {
            if (arg.equals("--help")) {
                out.println(USAGE);
                return EXIT_OK;
            } else if (arg.equals("--tokens")) {
                showTokens = true;
            } else if (arg.equals("--tree")) {
                showTree = true;
            } else if (arg.equals("--verbose")) {
                verbose = true;
            } else if (arg.startsWith("--indent=")) {
                try {
                    options = options.withSpaceIndent(Integer.parseInt(arg.substring("--indent=".length())));
                } catch (IllegalArgumentException e) {
                    err.println("ERROR: Invalid indent: " + arg);
                    return EXIT_USAGE;
                }
            } else if (arg.startsWith("--keywords=")) {
                Path keywordFile = Paths.get(arg.substring("--keywords=".length()));
                try {
                    options = options.withKeywords(KeywordTable.load(keywordFile));
                } catch (IOException | IllegalArgumentException e) {
                    err.println("ERROR: Cannot load keyword table " + keywordFile + ": " + e.getMessage());
                    return EXIT_USAGE;
                }
            } else if (arg.startsWith("--")) {
                err.println("ERROR: Unknown option: " + arg);
                err.println(USAGE);
                return EXIT_USAGE;
            } else {
                files.add(Paths.get(arg));
            }
        }

        ConsoleLogging.install(err, verbose);
        SampleCompiler compiler = new SampleCompiler(options);

        if (files.isEmpty()) {
            return interactive(compiler, in);
        }
        int status = EXIT_OK;
        for (Path file : files) {
            if (!compileFile(compiler, file)) {
                status = EXIT_COMPILE_ERROR;
            }
        }
        return status;
    }

    private boolean compileFile(SampleCompiler compiler, Path file) {
        if (!Files.isRegularFile(file)) {
            err.println("ERROR: File not found: " + file.toAbsolutePath());
            return false;
        }
        try {
            String source = Files.readString(file, StandardCharsets.UTF_8);
            return compileAndPrint(compiler, source);
        } catch (IOException e) {
            err.println("ERROR: Cannot read " + file + ": " + e.getMessage());
            return false;
        }
    }

    private boolean compileAndPrint(SampleCompiler compiler, String source) {
        CompilationResult result;
        try {
            result = compiler.compile(source);
        } catch (CompilationException e) {
            err.println(e);
            return false;
        }
        if (showTokens) {
            out.println(TokenListingFormatter.format(result.tokens()));
        }
        if (showTree) {
            out.print(SyntaxTreePrinter.print(result.program()));
        }
        out.println(result.output());
        return true;
    }

    private int interactive(SampleCompiler compiler, InputStream in) {
        out.println("Sample compiler. Type a program, 'source <file>' to compile a file, 'exit' to quit.");
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        StringBuilder programBuilder = new StringBuilder();
        int depth = 0;
        boolean opened = false;
        char openQuote = 0;
        try {
            while (true) {
                out.print(programBuilder.length() == 0 ? "sample> " : "     -> ");
                out.flush();
                String line = reader.readLine();
                if (line == null) {
                    break;
                }
                if (programBuilder.length() == 0) {
                    String command = line.trim();
                    if (command.equals("exit") || command.equals("exit;")) {
                        break;
                    }
                    if (command.startsWith("source ")) {
                        compileFile(compiler, Paths.get(command.substring("source ".length()).trim()));
                        continue;
                    }
                    if (command.isEmpty()) {
                        continue;
                    }
                }

                programBuilder.append(line).append('\n');
                // 字符串里的花括号不计数；字符串可以跨行，所以引号状态跨行保留
                for (int i = 0; i < line.length(); i++) {
                    char ch = line.charAt(i);
                    if (openQuote != 0) {
                        if (ch == openQuote) {
                            openQuote = 0;
                        }
                    } else if (ch == '"' || ch == '\'') {
                        openQuote = ch;
                    } else if (ch == '{') {
                        depth++;
                        opened = true;
                    } else if (ch == '}') {
                        depth--;
                    }
                }
                if (opened && depth <= 0 && openQuote == 0) {
                    compileAndPrint(compiler, programBuilder.toString());
                    programBuilder.setLength(0);
                    depth = 0;
                    opened = false;
                }
            }
        } catch (IOException e) {
            err.println("ERROR: " + e.getMessage());
            return EXIT_COMPILE_ERROR;
        }
        out.println("Bye!");
        return EXIT_OK;
    }
}
