package com.legacyport;

import com.legacyport.catalog.LegacyProfile;
import com.legacyport.fixer.FixerProfile;
import com.legacyport.fixer.Translator;
import com.legacyport.lexer.Lexer;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * 翻译吞吐基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class TranslatorBenchmark {

    private String source;
    private FixerProfile profile;
    private Lexer lexer;

    @Setup
    public void setup() {
        StringBuilder builder = new StringBuilder("\"\"\"Generated module.\"\"\"\n");
        // 生成约 2000 个函数的模块
        for (int i = 0; i < 2000; i++) {
            builder.append("class Item").append(i).append(":\n")
                .append("    def run(self, n):\n")
                .append("        # loop ").append(i).append('\n')
                .append("        for k in range(n):\n")
                .append("            print('item', k / 2, str(k))\n")
                .append("        return super().run(n)\n\n");
        }
        source = builder.toString();
        profile = LegacyProfile.create();
        lexer = new Lexer();
    }

    @Benchmark
    public int tokenize() {
        return lexer.tokenize(source).size();
    }

    @Benchmark
    public String translate() {
        return new Translator(source, profile, "bench.py", lexer).dump();
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
            .include(TranslatorBenchmark.class.getSimpleName())
            .build();
        new Runner(options).run();
    }
}
