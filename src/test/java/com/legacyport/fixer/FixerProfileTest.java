package com.legacyport.fixer;

import com.legacyport.fixer.FixerProfile.NamedFixer;
import com.legacyport.lexer.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FixerProfileTest {

    private static Fixer noop() {
        return (token, context) -> { };
    }

    @Test
    @DisplayName("规则按名称字典序执行，与注册顺序无关")
    void testLexicalOrder() {
        FixerProfile profile = FixerProfile.empty("test")
            .with("zeta", FixerProfileTest::noop)
            .with("alpha", FixerProfileTest::noop)
            .with("mid_2", FixerProfileTest::noop);

        assertEquals(List.of("alpha", "mid_2", "zeta"), profile.ruleNames());
        assertEquals(List.of("alpha", "mid_2", "zeta"),
            profile.instantiate().stream().map(NamedFixer::name).toList());
    }

    @Test
    @DisplayName("with/without 返回新实例，原 profile 不变")
    void testImmutability() {
        FixerProfile base = FixerProfile.empty("test").with("alpha", FixerProfileTest::noop);

        FixerProfile extended = base.with("beta", FixerProfileTest::noop);
        FixerProfile reduced = extended.without("alpha");

        assertEquals(List.of("alpha"), base.ruleNames());
        assertEquals(List.of("alpha", "beta"), extended.ruleNames());
        assertEquals(List.of("beta"), reduced.ruleNames());
        assertTrue(extended.contains("beta"));
        assertFalse(reduced.contains("alpha"));
        assertEquals("test", reduced.name());
    }

    @Test
    @DisplayName("非法规则名与未知规则会被拒绝")
    void testRejectsInvalidNames() {
        FixerProfile profile = FixerProfile.empty("test").with("alpha", FixerProfileTest::noop);

        assertThrows(IllegalArgumentException.class, () -> profile.with("Bad-Name", FixerProfileTest::noop));
        assertThrows(IllegalArgumentException.class, () -> profile.with("alpha", null));
        assertThrows(IllegalArgumentException.class, () -> profile.without("missing"));
        assertThrows(IllegalArgumentException.class, () -> profile.withoutAll(List.of("alpha", "missing")));
        assertThrows(IllegalArgumentException.class, () -> FixerProfile.empty(" "));
    }

    @Test
    @DisplayName("每次实例化都创建新的规则对象")
    void testFreshInstances() {
        FixerProfile profile = FixerProfile.empty("test").with("alpha", CountingFixer::new);

        Fixer first = profile.instantiate().get(0).fixer();
        Fixer second = profile.instantiate().get(0).fixer();

        assertNotSame(first, second);
    }

    private static final class CountingFixer implements Fixer {
        private int calls;

        @Override
        public void fix(Token token, FixContext context) {
            calls++;
        }
    }

    @Test
    @DisplayName("工厂返回 null 时报错")
    void testNullFactoryResult() {
        FixerProfile profile = FixerProfile.empty("test").with("alpha", () -> null);

        assertThrows(IllegalStateException.class, profile::instantiate);
    }
}
