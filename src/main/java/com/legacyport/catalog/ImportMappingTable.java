package com.legacyport.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 导入改写表：旧的点分模块路径 → 替换文本。
 * 以 "import " 或 "from " 开头的替换文本表示整条语句替换，其余视为模块改名。
 */
public final class ImportMappingTable {
    private static final Pattern MODULE_PATH = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private final Map<String, String> entries;

    private ImportMappingTable(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static ImportMappingTable of(Map<String, String> entries) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (entries != null) {
            entries.forEach((path, replacement) -> put(copy, path, replacement));
        }
        return new ImportMappingTable(copy);
    }

    /**
     * 标准库改名的默认表。
     */
    public static ImportMappingTable defaults() {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("reprlib", "repr");
        defaults.put("winreg", "_winreg");
        defaults.put("configparser", "ConfigParser");
        defaults.put("copyreg", "copy_reg");
        defaults.put("queue", "Queue");
        defaults.put("socketserver", "SocketServer");
        defaults.put("_markupbase", "markupbase");
        defaults.put("test.support", "test.test_support");
        defaults.put("dbm.bsd", "dbhash");
        defaults.put("dbm.ndbm", "dbm");
        defaults.put("dbm.dumb", "dumbdbm");
        defaults.put("dbm.gnu", "gdbm");
        defaults.put("html.parser", "HTMLParser");
        defaults.put("html.entities", "htmlentitydefs");
        defaults.put("http.client", "httplib");
        defaults.put("http.cookies", "Cookie");
        defaults.put("http.cookiejar", "cookielib");
        defaults.put("urllib.robotparser", "robotparser");
        defaults.put("xmlrpc.client", "xmlrpclib");
        defaults.put("builtins", "__builtin__");
        // urllib 只覆盖最常用的几个子模块
        defaults.put("urllib.request", "urllib2");
        defaults.put("urllib.error", "urllib2");
        defaults.put("urllib.parse", "urlparse");
        return of(defaults);
    }

    /**
     * 返回合并后的新表，overrides 中的同名条目覆盖当前条目。
     */
    public ImportMappingTable merge(Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(entries);
        if (overrides != null) {
            overrides.forEach((path, replacement) -> put(merged, path, replacement));
        }
        return new ImportMappingTable(merged);
    }

    public Optional<String> lookup(String modulePath) {
        return Optional.ofNullable(entries.get(modulePath));
    }

    public Map<String, String> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public static boolean isStatement(String replacement) {
        return replacement.startsWith("import ") || replacement.startsWith("from ");
    }

    private static void put(Map<String, String> target, String path, String replacement) {
        if (path == null || !MODULE_PATH.matcher(path).matches()) {
            throw new IllegalArgumentException("非法模块路径: " + path);
        }
        if (replacement == null || replacement.isBlank()) {
            throw new IllegalArgumentException("模块 " + path + " 的替换文本不能为空");
        }
        target.put(path, replacement);
    }
}
