package com.legacyport.fixer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * 规则注册表：规则名到规则工厂的映射，按规则名的字典序执行。
 * 不可变，with/without 返回新的 profile。每次翻译都会创建新的规则实例，
 * 因此规则可以在字段里保存单个文件内的状态。
 */
public final class FixerProfile {
    private static final Pattern RULE_NAME = Pattern.compile("[a-z][a-z0-9_]*");

    private final String name;
    private final SortedMap<String, Supplier<? extends Fixer>> rules;

    private FixerProfile(String name, SortedMap<String, Supplier<? extends Fixer>> rules) {
        this.name = name;
        this.rules = Collections.unmodifiableSortedMap(rules);
    }

    /**
     * 不含任何规则的 profile，翻译结果与输入相同。
     */
    public static FixerProfile empty(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("profile 名称不能为空");
        }
        return new FixerProfile(name, new TreeMap<>());
    }

    public String name() {
        return name;
    }

    /**
     * 新增或覆盖同名规则。
     */
    public FixerProfile with(String ruleName, Supplier<? extends Fixer> factory) {
        if (ruleName == null || !RULE_NAME.matcher(ruleName).matches()) {
            throw new IllegalArgumentException("规则名不合法: " + ruleName);
        }
        if (factory == null) {
            throw new IllegalArgumentException("规则工厂不能为空: " + ruleName);
        }
        TreeMap<String, Supplier<? extends Fixer>> copy = new TreeMap<>(rules);
        copy.put(ruleName, factory);
        return new FixerProfile(name, copy);
    }

    /**
     * 禁用规则。规则名不存在时抛出异常，避免配置拼写错误被静默忽略。
     */
    public FixerProfile without(String ruleName) {
        if (!rules.containsKey(ruleName)) {
            throw new IllegalArgumentException("profile " + name + " 中不存在规则: " + ruleName);
        }
        TreeMap<String, Supplier<? extends Fixer>> copy = new TreeMap<>(rules);
        copy.remove(ruleName);
        return new FixerProfile(name, copy);
    }

    public FixerProfile withoutAll(Collection<String> ruleNames) {
        FixerProfile profile = this;
        if (ruleNames != null) {
            for (String ruleName : ruleNames) {
                profile = profile.without(ruleName);
            }
        }
        return profile;
    }

    public boolean contains(String ruleName) {
        return rules.containsKey(ruleName);
    }

    /**
     * 按执行顺序排列的规则名。
     */
    public List<String> ruleNames() {
        return List.copyOf(rules.keySet());
    }

    /**
     * 为一次翻译创建新的规则实例，顺序与 {@link #ruleNames()} 一致。
     */
    public List<NamedFixer> instantiate() {
        List<NamedFixer> fixers = new ArrayList<>(rules.size());
        rules.forEach((ruleName, factory) -> {
            Fixer fixer = factory.get();
            if (fixer == null) {
                throw new IllegalStateException("规则工厂返回空实例: " + ruleName);
            }
            fixers.add(new NamedFixer(ruleName, fixer));
        });
        return List.copyOf(fixers);
    }

    public record NamedFixer(String name, Fixer fixer) {
    }
}
