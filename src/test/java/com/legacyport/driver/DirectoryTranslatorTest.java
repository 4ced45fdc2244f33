package com.legacyport.driver;

import com.legacyport.catalog.LegacyProfile;
import com.legacyport.config.Constants;
import com.legacyport.config.TranslatorConfig;
import com.legacyport.driver.FileOutcome.Status;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class DirectoryTranslatorTest {

    private static final String MARKED = "from __future__ import print_function\nprint(range(3))\n";

    @TempDir
    Path root;

    @BeforeEach
    void setUp() throws IOException {
        write("a.py", "for i in range(3): pass\n");
        write("b.py", MARKED);
        write("bad.py", "s = 'abc\n");
        write("d.py", "x = 1\n");
        write("vendor/c.py", "x = range(1)\n");
        write("notes.txt", "print(1)\n");
    }

    @Test
    @DisplayName("目录翻译: 结果按相对路径排序，单个文件失败不影响其余文件")
    void testTranslateDirectory() throws IOException {
        DirectoryTranslator translator = new DirectoryTranslator(LegacyProfile.create(), SkipSet.of(List.of("vendor")));

        BatchReport report = translator.translate(root);

        assertEquals(List.of("a.py", "b.py", "bad.py", "d.py", "vendor/c.py"),
            report.outcomes().stream().map(FileOutcome::relativePath).collect(Collectors.toList()));
        assertEquals(Status.TRANSLATED, report.outcomes().get(0).status());
        assertEquals(Status.MARKER_SKIPPED, report.outcomes().get(1).status());
        assertEquals(Status.FAILED, report.outcomes().get(2).status());
        assertEquals(Status.UNCHANGED, report.outcomes().get(3).status());
        assertEquals(Status.SKIPPED, report.outcomes().get(4).status());

        assertEquals("for i in xrange(3): pass\n", read("a.py"));
        assertEquals(MARKED, read("b.py"));
        assertEquals("s = 'abc\n", read("bad.py"));
        assertEquals("x = range(1)\n", read("vendor/c.py"));
        assertEquals("print(1)\n", read("notes.txt"));

        assertTrue(report.hasFailures());
        assertEquals(1, report.failures().size());
        assertTrue(report.failures().get(0).message().startsWith("LexerException"));
        assertEquals(root.toAbsolutePath().normalize().toString(), report.root());
    }

    @Test
    @DisplayName("翻译结果与原文相同时不写回文件")
    void testUnchangedFileIsNotRewritten() throws IOException {
        Path unchanged = root.resolve("d.py");
        FileTime old = FileTime.fromMillis(1_000_000L);
        Files.setLastModifiedTime(unchanged, old);

        new DirectoryTranslator(LegacyProfile.create(), SkipSet.empty()).translate(root);

        assertEquals(old, Files.getLastModifiedTime(unchanged));
    }

    @Test
    @DisplayName("写回后不残留临时文件")
    void testNoTemporaryFilesLeft() throws IOException {
        new DirectoryTranslator(LegacyProfile.create(), SkipSet.empty()).translate(root);

        try (Stream<Path> paths = Files.walk(root)) {
            assertFalse(paths.anyMatch(path -> path.toString().endsWith(Constants.TEMP_FILE_SUFFIX)));
        }
    }

    @Test
    @DisplayName("多线程翻译结果与顺序翻译一致")
    void testParallelTranslation() throws IOException {
        for (int i = 0; i < 20; i++) {
            write("pkg/m" + i + ".py", "def f(x):\n    return x / " + (i + 1) + "\n");
        }
        DirectoryTranslator translator = new DirectoryTranslator(
            LegacyProfile.create(), SkipSet.of(List.of("vendor")), Constants.COMPATIBILITY_MARKER,
            Constants.SOURCE_EXTENSION, 4);

        BatchReport report = translator.translate(root);

        assertEquals(25, report.outcomes().size());
        assertEquals(21, report.count(Status.TRANSLATED));
        assertEquals("pkg/m0.py", report.outcomes().get(4).relativePath());
        assertEquals("from __future__ import division\ndef f(x):\n    return x / 1\n", read("pkg/m0.py"));
    }

    @Test
    @DisplayName("根路径为单个文件")
    void testSingleFileRoot() throws IOException {
        BatchReport report = new DirectoryTranslator(LegacyProfile.create(), SkipSet.empty())
            .translate(root.resolve("a.py"));

        assertEquals(1, report.outcomes().size());
        assertEquals("a.py", report.outcomes().get(0).relativePath());
        assertEquals(Status.TRANSLATED, report.outcomes().get(0).status());
        assertEquals("for i in xrange(3): pass\n", read("a.py"));
    }

    @Test
    @DisplayName("按配置构建: 禁用规则、跳过集合与兼容标记")
    void testFromConfig() throws IOException {
        TranslatorConfig config = TranslatorConfig.defaults();
        config.setDisabledRules(List.of(LegacyProfile.RANGE));
        config.setSkip(List.of("bad.py", "vendor"));
        config.setMarkerSymbol("division");

        write("e.py", "print(range(3))\n");

        BatchReport report = new DirectoryTranslator(config).translate(root);

        assertFalse(report.hasFailures());
        assertEquals(Status.UNCHANGED, report.outcomes().get(0).status());
        assertEquals(Status.UNCHANGED, report.outcomes().get(1).status());
        assertEquals(MARKED, read("b.py"));
        assertEquals("e.py", report.outcomes().get(4).relativePath());
        assertEquals(Status.TRANSLATED, report.outcomes().get(4).status());
        assertEquals("print range(3)\n", read("e.py"));
    }

    @Test
    @DisplayName("写回后保留原文件的权限位")
    void testPermissionsPreserved() throws IOException {
        assumeTrue(root.getFileSystem().supportedFileAttributeViews().contains("posix"));
        Path script = root.resolve("a.py");
        Set<PosixFilePermission> permissions = PosixFilePermissions.fromString("rwxr-xr-x");
        Files.setPosixFilePermissions(script, permissions);

        FileOutcome outcome = new DirectoryTranslator(LegacyProfile.create(), SkipSet.empty())
            .translateFile(root, script);

        assertEquals(Status.TRANSLATED, outcome.status());
        assertEquals("for i in xrange(3): pass\n", read("a.py"));
        assertEquals(permissions, Files.getPosixFilePermissions(script));
    }

    @Test
    @DisplayName("词法错误的文件若声明了兼容标记，仍按标记跳过")
    void testMarkerCheckedBeforeLexerError() throws IOException {
        String broken = "from __future__ import (absolute_import,\n    print_function)\ns = 'abc\n";
        write("broken.py", broken);
        write("plain.py", "from __future__ import division\ns = 'abc\n");
        DirectoryTranslator translator = new DirectoryTranslator(LegacyProfile.create(), SkipSet.empty());

        assertEquals(Status.MARKER_SKIPPED, translator.translateFile(root, root.resolve("broken.py")).status());
        assertEquals(broken, read("broken.py"));
        assertEquals(Status.FAILED, translator.translateFile(root, root.resolve("plain.py")).status());
    }

    @Test
    @DisplayName("根路径不存在时报错")
    void testMissingRoot() {
        DirectoryTranslator translator = new DirectoryTranslator(LegacyProfile.create(), SkipSet.empty());

        assertThrows(IllegalArgumentException.class, () -> translator.translate(root.resolve("missing")));
    }

    private void write(String relativePath, String content) throws IOException {
        Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private String read(String relativePath) throws IOException {
        return Files.readString(root.resolve(relativePath), StandardCharsets.UTF_8);
    }
}
