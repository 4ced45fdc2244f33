package com.legacyport.driver;

/**
 * 单个文件的处理结果，relativePath 为相对根目录、以 / 分隔的路径。
 */
public record FileOutcome(String relativePath, Status status, String message) {

    public enum Status {
        /** 已翻译并写回 */
        TRANSLATED,
        /** 翻译结果与原文相同，未写回 */
        UNCHANGED,
        /** 命中跳过集合 */
        SKIPPED,
        /** 文件已导入兼容标记，视为手写的双方言代码 */
        MARKER_SKIPPED,
        /** 读取、词法分析、规则执行或写回失败 */
        FAILED
    }

    public static FileOutcome of(String relativePath, Status status) {
        return new FileOutcome(relativePath, status, null);
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }
}
