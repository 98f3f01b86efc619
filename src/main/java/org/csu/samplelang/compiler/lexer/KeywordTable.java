package org.csu.samplelang.compiler.lexer;

import org.csu.samplelang.compiler.syntax.SyntaxKind;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;

/**
 * @description: 关键字映射表
 *
 * 保留字到关键字种类的不可变映射，作为构造参数传给 {@link Lexer}，
 * 这样换一套关键字（例如本地化的关键字）不需要改动词法分析器。
 * 查找区分大小写。
 */
public final class KeywordTable {

    private static final KeywordTable DEFAULT;

    static {
        Map<String, SyntaxKind> keywords = new LinkedHashMap<>();
        keywords.put("program", SyntaxKind.PROGRAM_KEYWORD);
        keywords.put("call", SyntaxKind.CALL_KEYWORD);
        keywords.put("let", SyntaxKind.LET_KEYWORD);
        DEFAULT = new KeywordTable(keywords);
    }

    private final Map<String, SyntaxKind> keywords;

    private KeywordTable(Map<String, SyntaxKind> keywords) {
        this.keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    /**
     * 默认关键字表: program / call / let
     */
    public static KeywordTable defaults() {
        return DEFAULT;
    }

    /**
     * 从给定映射构建关键字表。
     *
     * @throws IllegalArgumentException 某个词不是合法的标识符，或者映射到的种类不是关键字
     */
    public static KeywordTable of(Map<String, SyntaxKind> keywords) {
        for (Map.Entry<String, SyntaxKind> entry : keywords.entrySet()) {
            validate(entry.getKey(), entry.getValue());
        }
        return new KeywordTable(keywords);
    }

    /**
     * 从 properties 构建关键字表，格式为 {@code word = KindName}，例如 {@code let = LetKeyword}。
     */
    public static KeywordTable fromProperties(Properties properties) {
        Map<String, SyntaxKind> keywords = new LinkedHashMap<>();
        // Properties 本身无序，排序后保证错误信息和 asMap() 的顺序稳定
        for (String word : new TreeSet<>(properties.stringPropertyNames())) {
            String kindName = properties.getProperty(word).trim();
            SyntaxKind kind = SyntaxKind.fromDisplayName(kindName);
            if (kind == null) {
                throw new IllegalArgumentException("Unknown syntax kind '" + kindName + "' for keyword '" + word + "'");
            }
            keywords.put(word.trim(), kind);
        }
        return of(keywords);
    }

    /**
     * 以 UTF-8 读取一个关键字表文件。
     */
    public static KeywordTable load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Properties properties = new Properties();
            properties.load(reader);
            return fromProperties(properties);
        }
    }

    /**
     * 以 UTF-8 从输入流读取关键字表，流由调用方关闭。
     */
    public static KeywordTable load(InputStream in) throws IOException {
        Properties properties = new Properties();
        properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        return fromProperties(properties);
    }

    private static void validate(String word, SyntaxKind kind) {
        if (word == null || word.isEmpty()) {
            throw new IllegalArgumentException("Keyword must not be empty");
        }
        if (kind == null || !kind.isKeyword()) {
            throw new IllegalArgumentException("'" + word + "' must map to a keyword kind, got "
                    + (kind == null ? "null" : kind.displayName()));
        }
        if (!CharClassifier.isIdentifierStart(word.charAt(0))) {
            throw new IllegalArgumentException("Keyword '" + word + "' must start with a letter");
        }
        for (int i = 1; i < word.length(); i++) {
            if (!CharClassifier.isIdentifierPart(word.charAt(i))) {
                throw new IllegalArgumentException("Keyword '" + word + "' contains an invalid character");
            }
        }
    }

    /**
     * @return 对应的关键字种类；不是关键字时返回 null
     */
    public SyntaxKind lookup(String text) {
        return keywords.get(text);
    }

    public boolean isKeyword(String text) {
        return keywords.containsKey(text);
    }

    public Map<String, SyntaxKind> asMap() {
        return keywords;
    }

    @Override
    public String toString() {
        return "KeywordTable" + keywords;
    }
}
