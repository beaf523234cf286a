import org.junit.jupiter.api.Test;

import com.ecolang.debug.Debug;
import com.ecolang.script.EcoLang;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URL;
import java.net.URLClassLoader;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loads the engine through its own class loader so Debug's static state is
 * initialized from scratch, whatever other test classes did to the shared copy.
 */
public class DebugStaticInitTest {

    private static URLClassLoader isolatedLoader() {
        URL[] urls = {
                location(EcoLang.class),
                location(ObjectMapper.class),
                location(JsonFactory.class),
                location(JsonProperty.class),
        };
        return new URLClassLoader(urls, ClassLoader.getPlatformClassLoader());
    }

    private static URL location(Class<?> type) {
        return type.getProtectionDomain().getCodeSource().getLocation();
    }

    @Test
    void freshHub_hasNoOpSinkAndLogsWithoutSetup() throws Exception {
        try (URLClassLoader loader = isolatedLoader()) {
            Class<?> debug = loader.loadClass(Debug.class.getName());
            assertNotSame(Debug.class, debug);

            Object hub = debug.getMethod("get").invoke(null);
            assertNotNull(debug.getMethod("getSink").invoke(hub));
            assertDoesNotThrow(() -> debug.getMethod("d", String.class, String.class).invoke(hub, "tag", "msg"));
        }
    }

    @Test
    void freshEngine_runsWithoutAnyDebugSetup() throws Exception {
        try (URLClassLoader loader = isolatedLoader()) {
            Class<?> engineType = loader.loadClass(EcoLang.class.getName());
            Object engine = engineType.getConstructor().newInstance();

            Object result = engineType.getMethod("execute", String.class).invoke(engine, "say 1\n");

            assertNull(result.getClass().getMethod("getError").invoke(result));
            assertEquals("1\n", result.getClass().getMethod("getOutput").invoke(result));
        }
    }

    @Test
    void clearingTheSink_fallsBackToNoOp() {
        Debug hub = Debug.get();
        hub.setSink(null);
        assertNotNull(hub.getSink());
        assertNull(new EcoLang().execute("say 1\n").getError());
    }
}
