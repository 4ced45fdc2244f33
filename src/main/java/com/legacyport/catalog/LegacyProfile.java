package com.legacyport.catalog;

import com.legacyport.config.TranslatorConfig;
import com.legacyport.fixer.FixerProfile;

/**
 * 新方言 → 旧方言的默认规则集。
 *
 * 不支持的构造（@ 矩阵乘运算符、nonlocal 绑定）不做检测，原样透传。
 */
public final class LegacyProfile {
    public static final String NAME = "legacy";

    public static final String ENCODE = "encode";
    public static final String FUTURE = "future";
    public static final String GETCWD = "getcwd";
    public static final String IMPORTS = "imports";
    public static final String NEWSTYLE = "newstyle";
    public static final String PRINT = "print";
    public static final String RANGE = "range";
    public static final String SUPER = "super";
    public static final String UNICODE = "unicode";
    public static final String UNICODE_LITERALS = "unicode_literals";

    private LegacyProfile() {
    }

    public static FixerProfile create() {
        return create(ImportMappingTable.defaults());
    }

    public static FixerProfile create(ImportMappingTable importMappings) {
        return FixerProfile.empty(NAME)
            .with(ENCODE, EncodeFixer::new)
            .with(FUTURE, FutureFixer::new)
            .with(GETCWD, GetcwdFixer::new)
            .with(IMPORTS, () -> new ImportFixer(importMappings))
            .with(NEWSTYLE, NewStyleClassFixer::new)
            .with(PRINT, PrintFixer::new)
            .with(RANGE, RangeFixer::new)
            .with(SUPER, SuperFixer::new)
            .with(UNICODE, UnicodeFixer::new)
            .with(UNICODE_LITERALS, UnicodeLiteralsFixer::new);
    }

    /**
     * 按配置合并导入改写表并禁用指定规则。
     */
    public static FixerProfile fromConfig(TranslatorConfig config) {
        ImportMappingTable table = ImportMappingTable.defaults().merge(config.getImportMappings());
        return create(table).withoutAll(config.getDisabledRules());
    }
}
