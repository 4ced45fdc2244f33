package com.legacyport.catalog;

import com.legacyport.fixer.FixerProfile;
import com.legacyport.fixer.Translator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UnicodeFixerTest {

    @Test
    @DisplayName("str/chr 调用与 isinstance 中的 str 改写")
    void testUnicodeNames() {
        FixerProfile profile = FixerProfile.empty("test").with(LegacyProfile.UNICODE, UnicodeFixer::new);
        String code = """
            str(x)
            chr(y)
            bla = str
            isinstance(x, str)
            isinstance(y, (bytes, str))
            obj.str(z)
            """;

        String result = new Translator(code, profile).dump();

        assertTrue(result.contains("unicode(x)"));
        assertTrue(result.contains("unichr(y)"));
        assertTrue(result.contains("bla = str"));
        assertTrue(result.contains("isinstance(x, basestring)"));
        assertTrue(result.contains("isinstance(y, (bytes, basestring))"));
        assertTrue(result.contains("obj.str(z)"));
    }

    @Test
    @DisplayName("无前缀字符串加 u 前缀，r 前缀变为 ur，b/u 前缀不变")
    void testUnicodeLiterals() {
        FixerProfile profile = FixerProfile.empty("test")
            .with(LegacyProfile.UNICODE_LITERALS, UnicodeLiteralsFixer::new);
        String code = """
            ''' a docstring
            '''
            r'''and another '''
            a = 'x' ; b = "x" ; c = r'x' ; d = r"x" ;
            k = u'x' ; l = b"x" ;
            """;

        String result = new Translator(code, profile).dump();

        assertTrue(result.startsWith("u''' a docstring"));
        assertTrue(result.contains("ur'''and another '''"));
        assertTrue(result.contains("a = u'x' ; b = u\"x\" ; c = ur'x' ; d = ur\"x\" ;"));
        assertTrue(result.contains("k = u'x' ; l = b\"x\" ;"));
    }

    @Test
    @DisplayName("无参 encode/decode 补 utf-8，getcwd 改为 getcwdu")
    void testEncodeAndGetcwd() {
        FixerProfile profile = FixerProfile.empty("test")
            .with(LegacyProfile.ENCODE, EncodeFixer::new)
            .with(LegacyProfile.GETCWD, GetcwdFixer::new);
        String code = "b = s.encode()\ns = b.decode( )\ny = x.encode(\"ascii\")\ngetcwd()\nos.getcwd()\n";

        assertEquals("b = s.encode(\"utf-8\")\ns = b.decode(\"utf-8\")\ny = x.encode(\"ascii\")\n"
            + "getcwdu()\nos.getcwdu()\n", new Translator(code, profile).dump());
    }
}
