import org.junit.jupiter.api.Test;

import com.ecolang.script.EcoLang;
import com.ecolang.script.runtime.RunResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;

import static org.junit.jupiter.api.Assertions.*;

public class RunResultJsonTest {

    private final ObjectMapper om = new ObjectMapper();

    private JsonNode json(RunResult r) throws Exception {
        return om.readTree(om.writeValueAsString(r));
    }

    @Test
    void success_shape() throws Exception {
        JsonNode n = json(new EcoLang().execute("let x = 5\nsay x\n"));

        Iterator<String> names = n.fieldNames();
        assertEquals("output", names.next());
        assertEquals("warnings", names.next());
        assertEquals("eco", names.next());
        assertEquals("errors", names.next());
        assertFalse(names.hasNext());

        assertEquals("5\n", n.get("output").asText());
        assertTrue(n.get("warnings").isArray());
        assertTrue(n.get("errors").isNull());

        JsonNode eco = n.get("eco");
        assertEquals(65, eco.get("total_ops").asLong());
        assertTrue(eco.has("energy_J"));
        assertTrue(eco.has("energy_kWh"));
        assertTrue(eco.has("co2_g"));
        assertTrue(eco.get("tips").isArray());
    }

    @Test
    void failure_shape() throws Exception {
        JsonNode n = json(new EcoLang().execute("say 1\nsay 1 / 0\n"));

        assertEquals("1", n.get("output").asText(), "no trailing newline on failure");
        assertTrue(n.get("eco").isNull());

        JsonNode err = n.get("errors");
        assertEquals("RUNTIME_ERROR", err.get("code").asText());
        assertEquals("division by zero", err.get("message").asText());
        assertEquals(2, err.get("line").asInt());
        assertEquals(7, err.get("column").asInt());
        assertEquals("say 1 / 0", err.get("context").get("line_text").asText());
        assertFalse(err.has("hint"), "absent fields are omitted");
    }

    @Test
    void syntaxError_includesHint() throws Exception {
        JsonNode err = json(new EcoLang().execute("repeat x times\nend\n")).get("errors");
        assertEquals("SYNTAX_ERROR", err.get("code").asText());
        assertEquals("Invalid repeat count", err.get("message").asText());
        assertEquals("Use: repeat <number> times", err.get("hint").asText());
    }
}
