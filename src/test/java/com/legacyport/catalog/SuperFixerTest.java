package com.legacyport.catalog;

import com.legacyport.fixer.FixerProfile;
import com.legacyport.fixer.Translator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SuperFixerTest {

    private static final FixerProfile PROFILE = FixerProfile.empty("test").with(LegacyProfile.SUPER, SuperFixer::new);

    @Test
    @DisplayName("方法中的 super() 补全类名与第一个形参，类外与函数中的不改写")
    void testNestedScopes() {
        String code = """
            class Foo:
                def bar(self):
                    super().bar()
                def spam(self):
                    super().spam()
                    class Foo2:
                        def eggs(self):
                            super().eggs()
            def spam():
                super().x
            super().y
            """;

        String result = new Translator(code, PROFILE).dump();

        assertTrue(result.contains("super().x"));
        assertTrue(result.contains("super().y"));
        assertTrue(result.contains("super(Foo, self).bar()"));
        assertTrue(result.contains("super(Foo, self).spam()"));
        assertTrue(result.contains("super(Foo2, self).eggs()"));
    }

    @Test
    @DisplayName("第一个形参不叫 self 时沿用其名称")
    void testClassMethodParameter() {
        String code = "class A(B):\n    @classmethod\n    def make(cls):\n        return super().make()\n";

        assertEquals("class A(B):\n    @classmethod\n    def make(cls):\n        return super(A, cls).make()\n",
            new Translator(code, PROFILE).dump());
    }

    @Test
    @DisplayName("带参数的 super 调用保持不变")
    void testExplicitArguments() {
        String code = "class A:\n    def f(self):\n        super(A, self).f()\n";

        assertEquals(code, new Translator(code, PROFILE).dump());
    }
}
