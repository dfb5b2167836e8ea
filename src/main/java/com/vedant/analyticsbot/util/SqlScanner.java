package com.vedant.analyticsbot.util;

/**
 * Balanced-parenthesis scanning shared by CTE decomposition, subquery extraction
 * and table extraction.
 *
 * All positions are offsets into the original text. Scanning works on a
 * "masked" copy in which comments and the contents of string literals are
 * blanked out, so a ')' inside 'a)b' never closes anything and a comment
 * between two tokens reads as whitespace. Masking preserves length, which
 * keeps offsets valid for the unmasked text.
 *
 * Recognized like PostgreSQL does: {@code --} line comments, nested block
 * comments, {@code '...'} literals with
 * {@code ''} escapes, {@code E'...'} literals with backslash escapes,
 * dollar-quoted {@code $tag$...$tag$} literals and {@code "..."} identifiers.
 * Quoted identifiers are skipped, not blanked.
 */
public final class SqlScanner {

    private SqlScanner() {}

    /** Blanks comments and string literal contents. */
    public static String mask(String sql) {
        return scan(sql, true);
    }

    /** Blanks comments only; literals stay readable. */
    public static String maskComments(String sql) {
        return scan(sql, false);
    }

    private static String scan(String sql, boolean maskLiterals) {
        if (sql == null) return "";
        char[] out = sql.toCharArray();
        int n = out.length;
        int i = 0;
        while (i < n) {
            char c = out[i];
            char next = i + 1 < n ? out[i + 1] : '\0';
            if (c == '-' && next == '-') {
                while (i < n && out[i] != '\n') out[i++] = ' ';
            } else if (c == '/' && next == '*') {
                i = blankBlockComment(out, i);
            } else if (c == '\'') {
                boolean backslashEscapes = i > 0 && (out[i - 1] == 'E' || out[i - 1] == 'e')
                        && (i < 2 || !isIdentifierChar(out[i - 2]));
                i = skipLiteral(out, i, backslashEscapes, maskLiterals);
            } else if (c == '"') {
                i = skipQuotedIdentifier(out, i);
            } else if (c == '$' && opensDollarQuote(out, i)) {
                i = skipDollarQuoted(sql, out, i, maskLiterals);
            } else {
                i++;
            }
        }
        return new String(out);
    }

    // /* ... */ nests in PostgreSQL; an unterminated comment runs to the end.
    private static int blankBlockComment(char[] out, int start) {
        int depth = 0;
        int j = start;
        while (j < out.length) {
            char c = out[j];
            char next = j + 1 < out.length ? out[j + 1] : '\0';
            if (c == '/' && next == '*') {
                depth++;
                out[j] = ' ';
                out[j + 1] = ' ';
                j += 2;
            } else if (c == '*' && next == '/') {
                depth--;
                out[j] = ' ';
                out[j + 1] = ' ';
                j += 2;
                if (depth == 0) return j;
            } else {
                out[j++] = ' ';
            }
        }
        return j;
    }

    // start is the opening quote; returns the index after the closing quote
    private static int skipLiteral(char[] out, int start, boolean backslashEscapes, boolean mask) {
        int j = start + 1;
        while (j < out.length) {
            char c = out[j];
            if (backslashEscapes && c == '\\' && j + 1 < out.length) {
                if (mask) {
                    out[j] = ' ';
                    out[j + 1] = ' ';
                }
                j += 2;
            } else if (c == '\'') {
                if (j + 1 < out.length && out[j + 1] == '\'') {
                    if (mask) {
                        out[j] = ' ';
                        out[j + 1] = ' ';
                    }
                    j += 2;
                } else {
                    return j + 1;
                }
            } else {
                if (mask) out[j] = ' ';
                j++;
            }
        }
        return j;
    }

    private static int skipQuotedIdentifier(char[] out, int start) {
        int j = start + 1;
        while (j < out.length) {
            if (out[j] == '"') {
                if (j + 1 < out.length && out[j + 1] == '"') {
                    j += 2;
                    continue;
                }
                return j + 1;
            }
            j++;
        }
        return j;
    }

    // $tag$ where tag is empty or an identifier; $1 is a parameter and a$b$ an identifier
    private static boolean opensDollarQuote(char[] out, int i) {
        if (i > 0 && (isIdentifierChar(out[i - 1]) || out[i - 1] == '$')) return false;
        int j = i + 1;
        if (j < out.length && Character.isDigit(out[j])) return false;
        while (j < out.length && isIdentifierChar(out[j])) j++;
        return j < out.length && out[j] == '$';
    }

    private static int skipDollarQuoted(String sql, char[] out, int start, boolean mask) {
        int tagEnd = sql.indexOf('$', start + 1);
        String delimiter = sql.substring(start, tagEnd + 1);
        int close = sql.indexOf(delimiter, tagEnd + 1);
        int contentEnd = close < 0 ? out.length : close;
        if (mask) {
            for (int j = tagEnd + 1; j < contentEnd; j++) out[j] = ' ';
        }
        return close < 0 ? out.length : close + delimiter.length();
    }

    /**
     * Index of the ')' matching the '(' at {@code openIndex}, or -1 when the
     * text ends before the count returns to zero.
     */
    public static int findClosing(String masked, int openIndex) {
        if (openIndex < 0 || openIndex >= masked.length() || masked.charAt(openIndex) != '(') {
            throw new IllegalArgumentException("No '(' at index " + openIndex);
        }
        int depth = 0;
        for (int i = openIndex; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    public static boolean isBalanced(String masked) {
        int depth = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) return false;
            }
        }
        return depth == 0;
    }

    /**
     * For every offset, the index of the innermost unclosed '(' that encloses
     * it, or -1 at top level.
     */
    public static int[] enclosingParens(String masked) {
        int[] result = new int[masked.length()];
        int[] stack = new int[masked.length() + 1];
        int top = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == ')' && top > 0) {
                top--;
            }
            result[i] = top > 0 ? stack[top - 1] : -1;
            if (c == '(') {
                stack[top++] = i;
            }
        }
        return result;
    }

    public static int skipWhitespace(String text, int pos) {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
        return pos;
    }

    /** True when the word at {@code pos} (ignoring leading whitespace) is {@code keyword}. */
    public static boolean startsWithKeyword(String text, int pos, String keyword) {
        int p = skipWhitespace(text, pos);
        int end = p + keyword.length();
        if (end > text.length()) return false;
        if (!text.regionMatches(true, p, keyword, 0, keyword.length())) return false;
        return end == text.length() || !isIdentifierChar(text.charAt(end));
    }

    public static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
