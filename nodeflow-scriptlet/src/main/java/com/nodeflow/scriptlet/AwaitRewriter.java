package com.nodeflow.scriptlet;

import java.util.Set;

/**
 * Turns the {@code await} operators of an async scriptlet body into {@code yield} expressions so the body can
 * run as a generator. {@code await x.y(z)} becomes {@code (yield x.y(z))}: the operand is one unary expression
 * with its member accesses, calls and indexes, which matches how {@code await} binds.
 * <p>
 * Strings, template literals and comments are copied untouched; {@code await} used as a property name
 * ({@code o.await}, {@code {await: 1}}) is left alone. Regular expression literals are not recognized.
 */
final class AwaitRewriter {

    private static final String AWAIT = "await";
    private static final Set<String> PREFIX_WORDS = Set.of("typeof", "void", "delete", "new");

    private final String src;
    private final StringBuilder out;
    private int pos;

    private AwaitRewriter(String src) {
        this.src = src;
        this.out = new StringBuilder(src.length() + 16);
    }

    static String rewrite(String body) {
        AwaitRewriter rewriter = new AwaitRewriter(body);
        rewriter.copyUntil('\0');
        return rewriter.out.toString();
    }

    private void copyUntil(char closer) {
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == closer) {
                return;
            }
            if (!copyToken()) {
                out.append(c);
                pos++;
            }
        }
    }

    /** Copies one string, comment, group or word starting at {@code pos}; false when none starts there. */
    private boolean copyToken() {
        char c = src.charAt(pos);
        if (c == '"' || c == '\'' || c == '`') {
            copyString(c);
            return true;
        }
        if (c == '/' && peek(1) == '/') {
            int end = src.indexOf('\n', pos);
            copyTo(end < 0 ? src.length() : end);
            return true;
        }
        if (c == '/' && peek(1) == '*') {
            int end = src.indexOf("*/", pos + 2);
            copyTo(end < 0 ? src.length() : end + 2);
            return true;
        }
        if (c == '(' || c == '[' || c == '{') {
            copyGroup();
            return true;
        }
        if (isWordChar(c)) {
            boolean member = lastSignificant() == '.' && !out.toString().endsWith("...");
            String word = readWord();
            if (AWAIT.equals(word) && !member && nextSignificant() != ':') {
                awaitExpression();
            } else {
                out.append(word);
            }
            return true;
        }
        return false;
    }

    /** Line breaks between {@code await} and its operand move behind the expression; yield must not see them. */
    private void awaitExpression() {
        int start = pos;
        while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) {
            pos++;
        }
        String skipped = src.substring(start, pos);
        out.append("(yield ");
        unary();
        out.append(')');
        skipped.chars().filter(ch -> ch == '\n').forEach(ch -> out.append('\n'));
    }

    private void unary() {
        copyWhitespace();
        if (pos >= src.length()) {
            return;
        }
        char c = src.charAt(pos);
        if (c == '!' || c == '~' || ((c == '+' || c == '-') && peek(1) != c)) {
            out.append(c);
            pos++;
            unary();
            return;
        }
        if (isWordChar(c)) {
            String word = readWord();
            if (AWAIT.equals(word)) {
                awaitExpression();
                return;
            }
            out.append(word);
            if (PREFIX_WORDS.contains(word)) {
                unary();
                return;
            }
            postfix();
            return;
        }
        if (c == '"' || c == '\'' || c == '`') {
            copyString(c);
            postfix();
            return;
        }
        if (c == '(' || c == '[' || c == '{') {
            copyGroup();
            postfix();
        }
    }

    /** Member accesses, calls and indexes chained onto an operand on the same line. */
    private void postfix() {
        while (pos < src.length()) {
            int save = pos;
            while (pos < src.length() && (src.charAt(pos) == ' ' || src.charAt(pos) == '\t')) {
                pos++;
            }
            String gap = src.substring(save, pos);
            char c = pos < src.length() ? src.charAt(pos) : '\0';
            if (c == '.' && peek(1) != '.') {
                out.append(gap).append('.');
                pos++;
                copyWhitespace();
                if (pos < src.length() && isWordChar(src.charAt(pos))) {
                    out.append(readWord());
                }
            } else if (c == '?' && peek(1) == '.') {
                out.append(gap).append("?.");
                pos += 2;
                if (pos < src.length() && isWordChar(src.charAt(pos))) {
                    out.append(readWord());
                }
            } else if (c == '(' || c == '[') {
                out.append(gap);
                copyGroup();
            } else if (c == '`') {
                out.append(gap);
                copyString(c);
            } else {
                pos = save;
                return;
            }
        }
    }

    private void copyGroup() {
        char open = src.charAt(pos);
        char close = open == '(' ? ')' : open == '[' ? ']' : '}';
        out.append(open);
        pos++;
        copyUntil(close);
        if (pos < src.length()) {
            out.append(close);
            pos++;
        }
    }

    private void copyString(char quote) {
        int i = pos + 1;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            i++;
            if (c == quote) {
                break;
            }
        }
        copyTo(Math.min(i, src.length()));
    }

    private void copyWhitespace() {
        int start = pos;
        while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) {
            pos++;
        }
        out.append(src, start, pos);
    }

    private void copyTo(int end) {
        out.append(src, pos, end);
        pos = end;
    }

    private String readWord() {
        int start = pos;
        while (pos < src.length() && isWordChar(src.charAt(pos))) {
            pos++;
        }
        return src.substring(start, pos);
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < src.length() ? src.charAt(i) : '\0';
    }

    private char lastSignificant() {
        for (int i = out.length() - 1; i >= 0; i--) {
            if (!Character.isWhitespace(out.charAt(i))) {
                return out.charAt(i);
            }
        }
        return '\0';
    }

    private char nextSignificant() {
        for (int i = pos; i < src.length(); i++) {
            if (!Character.isWhitespace(src.charAt(i))) {
                return src.charAt(i);
            }
        }
        return '\0';
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
