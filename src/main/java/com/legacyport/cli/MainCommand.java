package com.legacyport.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.legacyport.catalog.FutureImports;
import com.legacyport.catalog.LegacyProfile;
import com.legacyport.config.Constants;
import com.legacyport.config.TranslatorConfig;
import com.legacyport.driver.BatchReport;
import com.legacyport.driver.DirectoryTranslator;
import com.legacyport.driver.FileOutcome;
import com.legacyport.fixer.FixerProfile;
import com.legacyport.fixer.Translator;
import com.legacyport.lexer.Lexer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "legacy-port",
    description = "🐍 将新方言 Python 源码翻译为旧方言（2.7）",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.DirSubcommand.class,
        MainCommand.FileSubcommand.class,
        MainCommand.RulesSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configFile;

    @Option(names = {"--disable"}, description = "禁用的规则名（可指定多个）")
    private List<String> disabledRules;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🐍 新方言 → 旧方言源码翻译器");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 读取配置文件（若指定），再叠加命令行上的禁用规则。
     */
    TranslatorConfig resolveConfig() throws IOException {
        TranslatorConfig config = configFile == null ? TranslatorConfig.defaults() : TranslatorConfig.load(configFile);
        if (disabledRules != null && !disabledRules.isEmpty()) {
            List<String> merged = new ArrayList<>(config.getDisabledRules());
            for (String rule : disabledRules) {
                if (!merged.contains(rule)) {
                    merged.add(rule);
                }
            }
            config.setDisabledRules(merged);
        }
        return config;
    }

    private int resolveThreadCount(int requested) {
        if (requested <= 0) {
            System.err.printf("⚠️ 非法线程数 %d，已回退为默认值 %d%n", requested, Constants.DEFAULT_THREADS);
            return Constants.DEFAULT_THREADS;
        }
        if (requested > Constants.MAX_THREADS) {
            System.err.printf("⚠️ 线程数 %d 超过安全上限 %d，已自动限制%n", requested, Constants.MAX_THREADS);
            return Constants.MAX_THREADS;
        }
        return requested;
    }

    @Command(name = "dir", description = "📂 递归翻译目录并原地覆盖")
    static class DirSubcommand implements Callable<Integer> {

        @Parameters(description = "要翻译的根目录或文件", arity = "1")
        private Path root;

        @Option(names = {"-s", "--skip"}, description = "跳过的文件名、绝对路径或相对路径（可指定多个）")
        private List<String> skip;

        @Option(names = {"--threads"}, description = "翻译线程数", defaultValue = "0")
        private int threads;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                TranslatorConfig config = main.resolveConfig();
                if (skip != null) {
                    List<String> mergedSkip = new ArrayList<>(config.getSkip());
                    mergedSkip.addAll(skip);
                    config.setSkip(mergedSkip);
                }
                if (threads != 0) {
                    config.setThreads(main.resolveThreadCount(threads));
                }

                BatchReport report = new DirectoryTranslator(config).translate(root);
                if ("json".equalsIgnoreCase(format)) {
                    printJsonReport(report);
                } else {
                    printTextReport(report);
                }
                return report.hasFailures() ? 1 : 0;
            } catch (Exception exception) {
                System.err.println("❌ 翻译失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextReport(BatchReport report) {
            System.out.println("📁 根目录: " + report.root());
            for (FileOutcome outcome : report.outcomes()) {
                if (outcome.status() == FileOutcome.Status.TRANSLATED) {
                    System.out.println("   ✏️ " + outcome.relativePath());
                }
            }
            for (FileOutcome failure : report.failures()) {
                System.err.println("   ❌ " + failure.relativePath() + ": " + failure.message());
            }
            System.out.println("📊 改写 " + report.count(FileOutcome.Status.TRANSLATED)
                + "，未变 " + report.count(FileOutcome.Status.UNCHANGED)
                + "，跳过 " + (report.count(FileOutcome.Status.SKIPPED) + report.count(FileOutcome.Status.MARKER_SKIPPED))
                + "，失败 " + report.count(FileOutcome.Status.FAILED)
                + "，用时 " + report.elapsedMs() + "ms");
        }

        private void printJsonReport(BatchReport report) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        }
    }

    @Command(name = "file", description = "📄 翻译单个文件，默认输出到标准输出")
    static class FileSubcommand implements Callable<Integer> {

        @Parameters(description = "源文件路径", arity = "1")
        private Path file;

        @Option(names = {"-i", "--in-place"}, description = "原地覆盖源文件", defaultValue = "false")
        private boolean inPlace;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                TranslatorConfig config = main.resolveConfig();
                if (inPlace) {
                    FileOutcome outcome = new DirectoryTranslator(config).translate(file).outcomes().get(0);
                    if (outcome.isFailure()) {
                        System.err.println("❌ 翻译失败: " + outcome.message());
                        return 1;
                    }
                    System.out.println("✅ " + outcome.relativePath() + ": " + outcome.status());
                    return 0;
                }

                String source = Files.readString(file, StandardCharsets.UTF_8);
                Translator translator = new Translator(source, LegacyProfile.fromConfig(config),
                    file.toString(), new Lexer());
                if (FutureImports.imports(translator.parse(), config.getMarkerSymbol())) {
                    System.out.print(source);
                    return 0;
                }
                System.out.print(translator.dump());
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 翻译失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "rules", description = "📋 列出当前生效的规则（按执行顺序）")
    static class RulesSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                FixerProfile profile = LegacyProfile.fromConfig(main.resolveConfig());
                System.out.println("📋 profile: " + profile.name());
                for (String ruleName : profile.ruleNames()) {
                    System.out.println("   " + ruleName);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 读取规则失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
