package com.legacyport.driver;

import com.legacyport.catalog.FutureImports;
import com.legacyport.catalog.LegacyProfile;
import com.legacyport.config.Constants;
import com.legacyport.config.TranslatorConfig;
import com.legacyport.driver.FileOutcome.Status;
import com.legacyport.fixer.FixerProfile;
import com.legacyport.fixer.Translator;
import com.legacyport.graph.TokenGraph;
import com.legacyport.lexer.Lexer;
import com.legacyport.lexer.LexerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 递归翻译目录下的源文件并原地覆盖。
 * 单个文件失败只中止该文件，其余文件继续处理，失败列表汇总在 {@link BatchReport} 中。
 */
public class DirectoryTranslator {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryTranslator.class);
    private static final Charset SOURCE_CHARSET = Charset.forName(Constants.SOURCE_ENCODING);
    private static final Pattern FUTURE_IMPORT_LINE =
        Pattern.compile("^[ \\t]*from[ \\t]+__future__[ \\t]+import[ \\t]+(.*)$", Pattern.MULTILINE);

    private final FixerProfile profile;
    private final SkipSet skipSet;
    private final String markerSymbol;
    private final String extension;
    private final int threads;
    private final Lexer lexer = new Lexer();

    public DirectoryTranslator(FixerProfile profile, SkipSet skipSet) {
        this(profile, skipSet, Constants.COMPATIBILITY_MARKER, Constants.SOURCE_EXTENSION, Constants.DEFAULT_THREADS);
    }

    public DirectoryTranslator(TranslatorConfig config) {
        this(LegacyProfile.fromConfig(config), SkipSet.of(config.getSkip()),
            config.getMarkerSymbol(), config.getExtension(), config.getThreads());
    }

    public DirectoryTranslator(FixerProfile profile, SkipSet skipSet, String markerSymbol, String extension, int threads) {
        if (profile == null) {
            throw new IllegalArgumentException("profile 不能为空");
        }
        this.profile = profile;
        this.skipSet = skipSet == null ? SkipSet.empty() : skipSet;
        this.markerSymbol = markerSymbol == null ? Constants.COMPATIBILITY_MARKER : markerSymbol;
        this.extension = extension == null ? Constants.SOURCE_EXTENSION : extension;
        this.threads = Math.max(1, Math.min(threads, Constants.MAX_THREADS));
    }

    /**
     * 翻译 root 下的全部源文件；root 也可以是单个文件。
     *
     * @param root 根目录或文件
     * @return 按相对路径排序的处理结果
     * @throws UncheckedIOException 遍历目录失败时抛出
     */
    public BatchReport translate(Path root) {
        if (root == null || !Files.exists(root)) {
            throw new IllegalArgumentException("路径不存在: " + root);
        }
        long start = System.currentTimeMillis();
        Path normalizedRoot = root.toAbsolutePath().normalize();
        List<Path> files = discover(normalizedRoot);
        Path base = Files.isDirectory(normalizedRoot) ? normalizedRoot : normalizedRoot.getParent();
        logger.info("开始翻译 {}: 共 {} 个源文件, 线程数 {}", normalizedRoot, files.size(), threads);

        List<FileOutcome> outcomes = threads <= 1 || files.size() <= 1
            ? translateSequentially(base, files)
            : translateInParallel(base, files);

        BatchReport report = new BatchReport(normalizedRoot.toString(), outcomes,
            System.currentTimeMillis() - start, Instant.now());
        logger.info("翻译完成: 改写 {}, 未变 {}, 跳过 {}, 兼容标记跳过 {}, 失败 {}",
            report.count(Status.TRANSLATED), report.count(Status.UNCHANGED), report.count(Status.SKIPPED),
            report.count(Status.MARKER_SKIPPED), report.count(Status.FAILED));
        return report;
    }

    /**
     * 处理单个文件：跳过检查、兼容标记检查、翻译、写回。任何失败都只体现在返回值里。
     */
    public FileOutcome translateFile(Path base, Path file) {
        String relativePath = SkipSet.toSlashPath(base.relativize(file));
        if (relativePath.isEmpty()) {
            relativePath = String.valueOf(file.getFileName());
        }
        if (skipSet.matches(base, file)) {
            logger.debug("跳过 {}", relativePath);
            return FileOutcome.of(relativePath, Status.SKIPPED);
        }
        try {
            String original = Files.readString(file, SOURCE_CHARSET);
            Translator translator = new Translator(original, profile, relativePath, lexer);
            TokenGraph graph;
            try {
                graph = translator.parse();
            } catch (LexerException exception) {
                if (declaresMarker(original)) {
                    logger.debug("{} 已导入 {}，跳过（词法错误: {}）", relativePath, markerSymbol, exception.getMessage());
                    return FileOutcome.of(relativePath, Status.MARKER_SKIPPED);
                }
                throw exception;
            }
            if (FutureImports.imports(graph, markerSymbol)) {
                logger.debug("{} 已导入 {}，跳过", relativePath, markerSymbol);
                return FileOutcome.of(relativePath, Status.MARKER_SKIPPED);
            }
            String translated = translator.dump();
            if (translated.equals(original)) {
                return FileOutcome.of(relativePath, Status.UNCHANGED);
            }
            writeAtomically(file, translated);
            logger.debug("已翻译 {} ({} 处编辑)", relativePath, translator.translate().size());
            return FileOutcome.of(relativePath, Status.TRANSLATED);
        } catch (IOException | RuntimeException exception) {
            logger.warn("翻译失败: {} - {}", relativePath, exception.getMessage());
            return new FileOutcome(relativePath, Status.FAILED, describe(exception));
        }
    }

    private List<FileOutcome> translateSequentially(Path base, List<Path> files) {
        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        for (Path file : files) {
            outcomes.add(translateFile(base, file));
        }
        return outcomes;
    }

    private List<FileOutcome> translateInParallel(Path base, List<Path> files) {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(executor.submit(() -> translateFile(base, file)));
            }
            List<FileOutcome> outcomes = new ArrayList<>(files.size());
            for (int index = 0; index < futures.size(); index++) {
                try {
                    outcomes.add(futures.get(index).get());
                } catch (ExecutionException exception) {
                    String relativePath = SkipSet.toSlashPath(base.relativize(files.get(index)));
                    outcomes.add(new FileOutcome(relativePath, Status.FAILED, describe(exception.getCause())));
                }
            }
            return outcomes;
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("翻译线程被中断", exception);
        } finally {
            executor.shutdownNow();
        }
    }

    private List<Path> discover(Path root) {
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(extension))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException exception) {
            throw new UncheckedIOException("遍历目录失败: " + root, exception);
        }
    }

    /**
     * 先写临时文件再移动覆盖，保证不会留下写了一半的源文件。
     */
    private void writeAtomically(Path file, String content) throws IOException {
        Path temp = file.resolveSibling(file.getFileName() + Constants.TEMP_FILE_SUFFIX);
        try {
            Files.writeString(temp, content, SOURCE_CHARSET);
            PosixFileAttributeView view = Files.getFileAttributeView(file, PosixFileAttributeView.class);
            if (view != null) {
                Files.setPosixFilePermissions(temp, view.readAttributes().permissions());
            }
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException exception) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * 词法分析失败时按原文逐行查找 __future__ 导入，判断文件是否声明了标记特性。
     */
    private boolean declaresMarker(String text) {
        Matcher matcher = FUTURE_IMPORT_LINE.matcher(text);
        while (matcher.find()) {
            String names = matcher.group(1);
            if (names.startsWith("(")) {
                int close = text.indexOf(')', matcher.start(1));
                names = text.substring(matcher.start(1) + 1, close < 0 ? text.length() : close);
            }
            for (String line : names.split("\n")) {
                for (char terminator : new char[] {'#', ';'}) {
                    int cut = line.indexOf(terminator);
                    if (cut >= 0) {
                        line = line.substring(0, cut);
                    }
                }
                for (String name : line.replace('\\', ' ').split(",")) {
                    String[] words = name.trim().split("\\s+");
                    if (markerSymbol.equals(words[0])) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static String describe(Throwable throwable) {
        if (throwable == null) {
            return "未知错误";
        }
        String message = throwable.getMessage();
        return throwable.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
