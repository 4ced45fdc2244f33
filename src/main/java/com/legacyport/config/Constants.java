package com.legacyport.config;

/**
 * 全局常量定义
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    /** 源文件扩展名 */
    public static final String SOURCE_EXTENSION = ".py";
    /** 源文件编码 */
    public static final String SOURCE_ENCODING = "UTF-8";
    /** 兼容标记：文件已从 __future__ 导入该特性时视为手写的双方言代码，跳过翻译 */
    public static final String COMPATIBILITY_MARKER = "print_function";
    /** 原子写入时临时文件的后缀 */
    public static final String TEMP_FILE_SUFFIX = ".legacy-port.tmp";

    /** 默认翻译线程数 */
    public static final int DEFAULT_THREADS = 1;
    /** 翻译线程数上限 */
    public static final int MAX_THREADS = Math.max(1, Runtime.getRuntime().availableProcessors() * 2);
}
