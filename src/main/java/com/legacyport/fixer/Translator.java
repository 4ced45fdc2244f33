package com.legacyport.fixer;

import com.legacyport.graph.TokenGraph;
import com.legacyport.lexer.Lexer;
import com.legacyport.lexer.Token;

import java.util.List;

/**
 * 单个文件的翻译器。生命周期依次为 CONSTRUCTED → PARSED → TRANSLATED → DUMPED，
 * 每个阶段只执行一次，请求后面的阶段会自动完成前面的阶段。原文始终不变。
 */
public class Translator {

    public enum Stage {
        CONSTRUCTED,
        PARSED,
        TRANSLATED,
        DUMPED
    }

    private final String text;
    private final String sourceName;
    private final FixerProfile profile;
    private final Lexer lexer;
    private final Reconstructor reconstructor = new Reconstructor();

    private Stage stage = Stage.CONSTRUCTED;
    private TokenGraph graph;
    private List<Edit> edits;
    private String output;

    /**
     * 不带任何规则的翻译器，dump 结果与原文一致。
     */
    public Translator(String text) {
        this(text, FixerProfile.empty("base"));
    }

    public Translator(String text, FixerProfile profile) {
        this(text, profile, Lexer.DEFAULT_SOURCE_NAME, new Lexer());
    }

    public Translator(String text, FixerProfile profile, String sourceName, Lexer lexer) {
        if (text == null) {
            throw new IllegalArgumentException("源码不能为空");
        }
        if (profile == null) {
            throw new IllegalArgumentException("profile 不能为空");
        }
        this.text = text;
        this.profile = profile;
        this.sourceName = sourceName == null ? Lexer.DEFAULT_SOURCE_NAME : sourceName;
        this.lexer = lexer == null ? new Lexer() : lexer;
    }

    /**
     * 词法分析并建立 token 图。
     *
     * @throws com.legacyport.lexer.LexerException 源码存在未闭合的字符串时抛出
     */
    public TokenGraph parse() {
        if (graph == null) {
            List<Token> tokens = lexer.tokenize(text, sourceName);
            graph = new TokenGraph(text, tokens);
            stage = Stage.PARSED;
        }
        return graph;
    }

    /**
     * 运行 profile 中的全部规则，返回按位置排序的编辑。
     *
     * @throws TranslationException 规则执行失败时抛出
     */
    public List<Edit> translate() {
        if (edits == null) {
            TokenGraph tokenGraph = parse();
            edits = new FixerEngine(tokenGraph, profile.instantiate(), sourceName).run();
            stage = Stage.TRANSLATED;
        }
        return edits;
    }

    /**
     * 生成翻译后的文本。
     */
    public String dump() {
        if (output == null) {
            List<Edit> allEdits = translate();
            output = reconstructor.dump(text, allEdits);
            stage = Stage.DUMPED;
        }
        return output;
    }

    public List<Token> tokens() {
        return parse().tokens();
    }

    public Stage stage() {
        return stage;
    }

    public String originalText() {
        return text;
    }

    public String sourceName() {
        return sourceName;
    }

    public FixerProfile profile() {
        return profile;
    }
}
