package com.legacyport.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImportMappingTableTest {

    @Test
    @DisplayName("默认表包含常用标准库改名")
    void testDefaults() {
        ImportMappingTable table = ImportMappingTable.defaults();

        assertEquals(23, table.size());
        assertEquals(Optional.of("Queue"), table.lookup("queue"));
        assertEquals(Optional.of("urllib2"), table.lookup("urllib.request"));
        assertEquals(Optional.of("__builtin__"), table.lookup("builtins"));
        assertFalse(table.lookup("os").isPresent());
    }

    @Test
    @DisplayName("合并返回新表，覆盖同名条目")
    void testMerge() {
        ImportMappingTable defaults = ImportMappingTable.defaults();

        ImportMappingTable merged = defaults.merge(Map.of("queue", "import Queue as queue", "tkinter", "Tkinter"));

        assertEquals(Optional.of("Queue"), defaults.lookup("queue"));
        assertEquals(Optional.of("import Queue as queue"), merged.lookup("queue"));
        assertEquals(Optional.of("Tkinter"), merged.lookup("tkinter"));
        assertEquals(24, merged.size());
        assertThrows(UnsupportedOperationException.class, () -> merged.entries().put("x", "y"));
    }

    @Test
    @DisplayName("非法模块路径与空替换文本被拒绝")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> ImportMappingTable.of(Map.of("bad path", "x")));
        assertThrows(IllegalArgumentException.class, () -> ImportMappingTable.of(Map.of("a..b", "x")));
        assertThrows(IllegalArgumentException.class, () -> ImportMappingTable.of(Map.of("queue", " ")));
        assertEquals(0, ImportMappingTable.of(null).size());
    }

    @Test
    @DisplayName("以 import/from 开头的替换文本视为整条语句")
    void testIsStatement() {
        assertTrue(ImportMappingTable.isStatement("import Queue as queue"));
        assertTrue(ImportMappingTable.isStatement("from six.moves import queue"));
        assertFalse(ImportMappingTable.isStatement("Queue"));
        assertFalse(ImportMappingTable.isStatement("importlib2"));
    }
}
