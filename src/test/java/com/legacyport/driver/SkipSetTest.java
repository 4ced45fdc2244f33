package com.legacyport.driver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SkipSetTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("裸文件名在任意层级生效")
    void testBareName() {
        SkipSet skipSet = SkipSet.of(List.of("setup.py", "vendor"));

        assertTrue(skipSet.matches(root, root.resolve("setup.py")));
        assertTrue(skipSet.matches(root, root.resolve("pkg/setup.py")));
        assertTrue(skipSet.matches(root, root.resolve("vendor/lib/a.py")));
        assertFalse(skipSet.matches(root, root.resolve("pkg/vendored.py")));
    }

    @Test
    @DisplayName("相对路径与目录前缀")
    void testRelativePath() {
        SkipSet skipSet = SkipSet.of(List.of("./pkg/gen/", "pkg\\mod.py"));

        assertTrue(skipSet.matches(root, root.resolve("pkg/gen/a.py")));
        assertTrue(skipSet.matches(root, root.resolve("pkg/mod.py")));
        assertFalse(skipSet.matches(root, root.resolve("other/pkg/mod.py")));
        assertFalse(skipSet.matches(root, root.resolve("pkg/other.py")));
    }

    @Test
    @DisplayName("绝对路径")
    void testAbsolutePath() {
        Path target = root.resolve("pkg/a.py").toAbsolutePath();
        SkipSet skipSet = SkipSet.of(List.of(target.toString(), root.resolve("build").toAbsolutePath().toString()));

        assertTrue(skipSet.matches(root, target));
        assertTrue(skipSet.matches(root, root.resolve("build/x.py")));
        assertFalse(skipSet.matches(root, root.resolve("pkg/b.py")));
    }

    @Test
    @DisplayName("空集合与空白条目")
    void testEmpty() {
        assertTrue(SkipSet.empty().isEmpty());
        assertTrue(SkipSet.of(Arrays.asList(" ", null)).isEmpty());
        assertFalse(SkipSet.of(null).matches(root, root.resolve("a.py")));
    }
}
