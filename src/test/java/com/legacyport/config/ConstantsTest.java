package com.legacyport.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Constructor;
import org.junit.jupiter.api.Test;

class ConstantsTest {

    @Test
    void testConstantValues() {
        assertEquals(".py", Constants.SOURCE_EXTENSION);
        assertEquals("UTF-8", Constants.SOURCE_ENCODING);
        assertEquals("print_function", Constants.COMPATIBILITY_MARKER);
        assertEquals(".legacy-port.tmp", Constants.TEMP_FILE_SUFFIX);
        assertEquals(1, Constants.DEFAULT_THREADS);
        assertTrue(Constants.MAX_THREADS >= Constants.DEFAULT_THREADS);
    }

    @Test
    void testPrivateConstructorReachableByReflection() throws Exception {
        Constructor<Constants> constructor = Constants.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        Constants constantsInstance = constructor.newInstance();
        assertNotNull(constantsInstance);
    }
}
