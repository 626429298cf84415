package com.example.docxtext.util.docx.text;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * 编号列表的ascii符号
 *
 * 只覆盖六种基本格式，输出保持纯ascii：
 * <pre>
 * --  bullet
 * 1   decimal
 * a   lowerLetter
 * A   upperLetter
 * i   lowerRoman
 * I   upperRoman
 * </pre>
 * 不处理 1.1.1、b)、(ii) 这类组合格式。
 */
public final class NumberingFormats {

    public static final String BULLET = "--";

    private static final Set<String> SUPPORTED = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "decimal", "lowerLetter", "upperLetter", "lowerRoman", "upperRoman", "bullet")));

    private static final int[] ROMAN_VALUES = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
    private static final String[] ROMAN_SYMBOLS = {"m", "cm", "d", "cd", "c", "xc", "l", "xl", "x", "ix", "v", "iv", "i"};

    private NumberingFormats() {
    }

    public static boolean isSupported(String numFmt) {
        return numFmt != null && SUPPORTED.contains(numFmt);
    }

    /**
     * 按 numFmt 把计数转成符号
     *
     * @throws IllegalArgumentException 格式不支持，或该格式无法表示这个数（如字母编号的0）
     */
    public static String format(String numFmt, int n) {
        if (numFmt == null) {
            throw new IllegalArgumentException("numFmt为空");
        }
        switch (numFmt) {
            case "decimal":
                return decimal(n);
            case "lowerLetter":
                return lowerLetter(n);
            case "upperLetter":
                return upperLetter(n);
            case "lowerRoman":
                return lowerRoman(n);
            case "upperRoman":
                return upperRoman(n);
            case "bullet":
                return BULLET;
            default:
                throw new IllegalArgumentException("不支持的编号格式: " + numFmt);
        }
    }

    public static String decimal(int n) {
        return String.valueOf(n);
    }

    /**
     * 26进制字母：a, b, ... z, aa, ab ...
     */
    public static String lowerLetter(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("字母编号不支持小于1的数: " + n);
        }
        StringBuilder sb = new StringBuilder();
        int remaining = n;
        while (remaining > 0) {
            int remainder = (remaining - 1) % 26;
            sb.insert(0, (char) ('a' + remainder));
            remaining = (remaining - 1) / 26;
        }
        return sb.toString();
    }

    public static String upperLetter(int n) {
        return lowerLetter(n).toUpperCase();
    }

    /**
     * 小写罗马数字；超过3999时继续叠加 m，不使用上划线
     */
    public static String lowerRoman(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("罗马数字不支持小于1的数: " + n);
        }
        StringBuilder sb = new StringBuilder();
        int remaining = n;
        for (int i = 0; i < ROMAN_VALUES.length; i++) {
            while (remaining >= ROMAN_VALUES[i]) {
                sb.append(ROMAN_SYMBOLS[i]);
                remaining -= ROMAN_VALUES[i];
            }
        }
        return sb.toString();
    }

    public static String upperRoman(int n) {
        return lowerRoman(n).toUpperCase();
    }
}
