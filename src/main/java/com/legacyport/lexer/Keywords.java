package com.legacyport.lexer;

import java.util.HashSet;
import java.util.Set;

public final class Keywords {

    /** 两种方言共有的保留字 */
    public static final Set<String> COMMON = Set.of(
        "and", "as", "assert", "break", "class", "continue", "def", "del",
        "elif", "else", "except", "finally", "for", "from", "global", "if",
        "import", "in", "is", "lambda", "not", "or", "pass", "raise",
        "return", "try", "while", "with", "yield"
    );

    /** 仅新方言的保留字 */
    public static final Set<String> MODERN_ONLY = Set.of(
        "False", "None", "True", "nonlocal", "async", "await"
    );

    /** 仅旧方言的保留字 */
    public static final Set<String> LEGACY_ONLY = Set.of(
        "print", "exec"
    );

    /** 默认保留字集合：两种方言的并集 */
    public static final Set<String> ALL = union(COMMON, MODERN_ONLY, LEGACY_ONLY);

    private Keywords() {
    }

    /**
     * 判断标识符是否为默认集合中的保留字。
     */
    public static boolean isKeyword(String word) {
        if (word == null || word.isEmpty()) {
            return false;
        }
        return ALL.contains(word);
    }

    @SafeVarargs
    private static Set<String> union(Set<String>... sets) {
        Set<String> merged = new HashSet<>();
        for (Set<String> set : sets) {
            merged.addAll(set);
        }
        return Set.copyOf(merged);
    }
}
