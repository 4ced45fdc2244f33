package com.legacyport.lexer;

/**
 * 词法错误，携带源文件名与出错的字符偏移。
 */
public class LexerException extends RuntimeException {
    private final String sourceName;
    private final int offset;
    private final int line;
    private final int column;

    public LexerException(String message, String sourceName, int offset, String text) {
        super(buildMessage(message, sourceName, offset, text));
        this.sourceName = sourceName;
        this.offset = offset;
        this.line = lineOf(text, offset);
        this.column = columnOf(text, offset);
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getOffset() {
        return offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    private static String buildMessage(String message, String sourceName, int offset, String text) {
        int line = lineOf(text, offset);
        int column = columnOf(text, offset);
        String excerpt = lineText(text, offset);
        String pointer = " ".repeat(Math.max(0, column - 1)) + "^";
        return sourceName + ":" + line + ":" + column + " (offset " + offset + "): " + message
                + System.lineSeparator() + excerpt + System.lineSeparator() + pointer;
    }

    private static int lineOf(String text, int offset) {
        int line = 1;
        int limit = Math.min(offset, text.length());
        for (int index = 0; index < limit; index++) {
            if (text.charAt(index) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static int columnOf(String text, int offset) {
        int limit = Math.min(offset, text.length());
        int lineStart = text.lastIndexOf('\n', limit - 1) + 1;
        return limit - lineStart + 1;
    }

    private static String lineText(String text, int offset) {
        int limit = Math.min(offset, text.length());
        int lineStart = text.lastIndexOf('\n', limit - 1) + 1;
        int lineEnd = text.indexOf('\n', limit);
        if (lineEnd < 0) {
            lineEnd = text.length();
        }
        return text.substring(lineStart, lineEnd).replace("\r", "");
    }
}
