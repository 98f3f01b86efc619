package org.csu.samplelang.compiler.lexer;

/**
 * @description: 字符分类
 *
 * 纯函数，没有状态也不会抛异常。字母表是 ASCII 拉丁字母加上匈牙利语的带重音元音。
 */
public final class CharClassifier {

    private static final String ACCENTED_LETTERS = "áéíóöőúüűÁÉÍÓÖŐÚÜŰ";

    private CharClassifier() {
    }

    public static boolean isLineBreak(int ch) {
        return ch == '\n'
                || ch == '\r'
                || ch == 0x2028   // line separator
                || ch == 0x2029;  // paragraph separator
    }

    /**
     * 单行空白。U+0085 (NEL) 在这里算空白而不是换行。
     */
    public static boolean isWhiteSpaceSingleLine(int ch) {
        return ch == ' '
                || ch == '\t'
                || ch == 0x0B     // vertical tab
                || ch == '\f'
                || ch == 0x00A0   // no-break space
                || ch == 0x0085
                || ch == 0x1680   // ogham space mark
                || ch >= 0x2000 && ch <= 0x200B
                || ch == 0x202F
                || ch == 0x205F
                || ch == 0x3000
                || ch == 0xFEFF;  // BOM
    }

    public static boolean isWhiteSpace(int ch) {
        return isWhiteSpaceSingleLine(ch) || isLineBreak(ch);
    }

    public static boolean isDigit(int ch) {
        return ch >= '0' && ch <= '9';
    }

    public static boolean isLetter(int ch) {
        return ch >= 'A' && ch <= 'Z'
                || ch >= 'a' && ch <= 'z'
                || ch > 0x7F && ACCENTED_LETTERS.indexOf(ch) >= 0;
    }

    public static boolean isLetterOrDigit(int ch) {
        return isLetter(ch) || isDigit(ch);
    }

    public static boolean isIdentifierStart(int ch) {
        return isLetter(ch);
    }

    public static boolean isIdentifierPart(int ch) {
        return isLetter(ch) || isDigit(ch) || ch == '_';
    }
}
