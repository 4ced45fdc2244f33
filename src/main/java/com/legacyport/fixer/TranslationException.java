package com.legacyport.fixer;

/**
 * 规则执行失败，整份文件的翻译随之中止。
 */
public class TranslationException extends RuntimeException {
    private final String sourceName;
    private final String ruleName;
    private final int offset;

    public TranslationException(String sourceName, String ruleName, int offset, Throwable cause) {
        super("规则 " + ruleName + " 在 " + sourceName + " 偏移 " + offset + " 处执行失败: "
                + (cause == null ? "" : cause.getMessage()), cause);
        this.sourceName = sourceName;
        this.ruleName = ruleName;
        this.offset = offset;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getRuleName() {
        return ruleName;
    }

    public int getOffset() {
        return offset;
    }
}
