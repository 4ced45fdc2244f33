package com.legacyport.fixer;

import com.legacyport.fixer.FixerProfile.NamedFixer;
import com.legacyport.graph.TokenGraph;
import com.legacyport.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 单遍规则分发：按文档顺序遍历 token，对每个 token 按固定顺序调用全部规则。
 * 同一 token 被多个规则修改时，后执行的规则生效。
 */
public final class FixerEngine {
    private static final Logger logger = LoggerFactory.getLogger(FixerEngine.class);

    private final TokenGraph graph;
    private final List<NamedFixer> fixers;
    private final String sourceName;

    public FixerEngine(TokenGraph graph, List<NamedFixer> fixers, String sourceName) {
        if (graph == null || fixers == null) {
            throw new IllegalArgumentException("token 图与规则列表不能为空");
        }
        this.graph = graph;
        this.fixers = List.copyOf(fixers);
        this.sourceName = sourceName;
    }

    /**
     * 执行全部规则并返回按位置排序的编辑列表，原文不做任何改动。
     *
     * @throws TranslationException 任一规则抛出异常时抛出
     */
    public List<Edit> run() {
        EditLog editLog = new EditLog(graph.text().length());
        FixContext context = new FixContext(graph, editLog, sourceName);
        for (Token token : graph.tokens()) {
            for (NamedFixer namedFixer : fixers) {
                try {
                    namedFixer.fixer().fix(token, context);
                } catch (TranslationException exception) {
                    throw exception;
                } catch (RuntimeException exception) {
                    throw new TranslationException(sourceName, namedFixer.name(), token.start(), exception);
                }
            }
        }
        logger.debug("{}: {} 个 token, {} 条规则, 产生 {} 处编辑",
            sourceName, graph.size(), fixers.size(), editLog.size());
        return editLog.edits();
    }
}
