package org.csu.samplelang.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @description: 命令行编译器的测试，输出写入内存中的流
 */
public class SampleShellTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private SampleShell shell;

    @BeforeEach
    void setUp() {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        shell = new SampleShell(new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static InputStream input(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testCompileFile() throws Exception {
        System.out.println("--- Running test: testCompileFile ---");
        Path file = write("hello.sample", "program Hello {\n  call speak 'Hi';\n}\n");

        int status = shell.run(new String[]{file.toString()}, input(""));
        System.out.println(out());

        assertEquals(SampleShell.EXIT_OK, status);
        assertEquals("(function Hello() {\n\tspeak('Hi');\n})();" + System.lineSeparator(), out());
        assertEquals("", err());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTokensAndTreeAreShownBeforeOutput() throws Exception {
        Path file = write("p.sample", "program P { let a; }");
        int status = shell.run(new String[]{"--tokens", "--tree", "--indent=2", file.toString()}, input(""));

        assertEquals(SampleShell.EXIT_OK, status);
        String text = out();
        int table = text.indexOf("| Syntax Kind ");
        int tree = text.indexOf("Program\n  ProgramKeyword 'program'");
        int code = text.indexOf("(function P() {\n  let a;\n})();");
        assertTrue(table >= 0, text);
        assertTrue(tree > table, text);
        assertTrue(code > tree, text);
        assertTrue(text.contains("13 tokens."), text);
    }

    @Test
    void testCompileErrorGoesToStderr() throws Exception {
        Path bad = write("bad.sample", "program Bad { let x = ; }");
        Path good = write("good.sample", "program Good {}");

        int status = shell.run(new String[]{bad.toString(), good.toString()}, input(""));

        assertEquals(SampleShell.EXIT_COMPILE_ERROR, status);
        assertTrue(err().startsWith("Syntax Error: An expression expected instead of the token 'SemicolonToken'."),
                err());
        // 后面的文件照常编译
        assertTrue(out().contains("(function Good() {\n})();"));
    }

    @Test
    void testMissingFile() {
        int status = shell.run(new String[]{tempDir.resolve("nope.sample").toString()}, input(""));
        assertEquals(SampleShell.EXIT_COMPILE_ERROR, status);
        assertTrue(err().startsWith("ERROR: File not found: "), err());
    }

    @Test
    void testUsageErrors() {
        assertEquals(SampleShell.EXIT_USAGE, shell.run(new String[]{"--frobnicate"}, input("")));
        assertTrue(err().contains("ERROR: Unknown option: --frobnicate"));
        assertTrue(err().contains("Usage: samplec"));

        assertEquals(SampleShell.EXIT_USAGE, shell.run(new String[]{"--indent=-3"}, input("")));
        assertTrue(err().contains("ERROR: Invalid indent: --indent=-3"));

        assertEquals(SampleShell.EXIT_USAGE, shell.run(new String[]{"--indent=wide"}, input("")));
        assertEquals(SampleShell.EXIT_USAGE,
                shell.run(new String[]{"--keywords=" + tempDir.resolve("missing.properties")}, input("")));
        assertTrue(err().contains("ERROR: Cannot load keyword table"));
    }

    @Test
    void testHelp() {
        assertEquals(SampleShell.EXIT_OK, shell.run(new String[]{"--help"}, input("")));
        assertTrue(out().startsWith("Usage: samplec [options] [file...]"));
        assertTrue(out().contains("--keywords=<file>"));
    }

    @Test
    void testCustomKeywordFile() throws Exception {
        Path keywords = write("hu.properties", "program = ProgramKeyword\nhívd = CallKeyword\nlegyen = LetKeyword\n");
        Path file = write("hu.sample", "program P { legyen a = 1; hívd kiír a }");

        int status = shell.run(new String[]{"--keywords=" + keywords, file.toString()}, input(""));

        assertEquals(SampleShell.EXIT_OK, status, err());
        assertTrue(out().contains("\tlet a = 1;\n\tkiír(a);"));
    }

    @Test
    void testInteractiveSession() throws Exception {
        System.out.println("--- Running test: testInteractiveSession ---");
        Path file = write("other.sample", "program Other {}");
        String session = String.join("\n",
                "",
                "program Demo {",
                "  let x = 2 * 3;",
                "}",
                "program Broken { let = 1; }",
                "source " + file,
                "exit",
                "program Never {}");

        int status = shell.run(new String[0], input(session));
        System.out.println(out());

        assertEquals(SampleShell.EXIT_OK, status);
        String text = out();
        assertTrue(text.contains("sample> "));
        assertTrue(text.contains("     -> "), "continuation prompt while braces are open");
        assertTrue(text.contains("(function Demo() {\n\tlet x = 2*3;\n})();"));
        assertTrue(text.contains("(function Other() {\n})();"));
        assertFalse(text.contains("Never"));
        assertTrue(text.trim().endsWith("Bye!"));
        assertTrue(err().contains("Syntax Error: IdentifierToken expected instead of the token 'EqualsToken'."), err());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testInteractiveBracesInsideStringsAreIgnored() {
        System.out.println("--- Running test: testInteractiveBracesInsideStringsAreIgnored ---");
        String session = String.join("\n",
                "program Braces {",
                "  call speak \"}\";",
                "  let s = '{ multi",
                "  } line';",
                "}",
                "exit");

        int status = shell.run(new String[0], input(session));
        System.out.println(out());

        assertEquals(SampleShell.EXIT_OK, status);
        assertEquals("", err());
        assertTrue(out().contains("(function Braces() {\n\tspeak(\"}\");\n\tlet s = '{ multi\\n  } line';\n})();"),
                out());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testInteractiveSessionEndsAtEndOfInput() {
        int status = shell.run(new String[0], input("program Open {\n  let a;\n"));
        assertEquals(SampleShell.EXIT_OK, status);
        assertFalse(out().contains("(function Open"));
        assertTrue(out().trim().endsWith("Bye!"));
    }

    @Test
    void testVerboseLogsCompilation() throws Exception {
        Path file = write("v.sample", "program V {}");
        int status = shell.run(new String[]{"--verbose", file.toString()}, input(""));
        assertEquals(SampleShell.EXIT_OK, status);
        assertTrue(err().contains("Compiled program 'V'"), err());
    }
}
