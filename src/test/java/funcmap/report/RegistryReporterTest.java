package funcmap.report;

import static org.junit.jupiter.api.Assertions.*;

import funcmap.base.Address;
import funcmap.base.function.FunctionRegistry;

import java.io.File;
import java.io.IOException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class RegistryReporterTest {
    @TempDir
    File outputDir;

    @Test
    public void testDump() throws IOException {
        var registry = new FunctionRegistry();
        registry.transitTo(Address.of(0x1000), Address.of(0x1000), Address.of(0x1010));
        registry.callTo(Address.of(0x1000), Address.of(0x1010), Address.of(0x2000), Address.of(0x1020));
        registry.returnFrom(Address.of(0x1000), Address.of(0x1020));
        var func = registry.lookup(Address.of(0x1000)).orElseThrow();
        func.setName("main");
        func.addArgumentRegister(16);
        func.addArgumentStackVariable(4);
        func.setSpDifference(8);

        File reportFile = new RegistryReporter().dump(registry, outputDir);
        assertEquals(RegistryReporter.REPORT_FILE_NAME, reportFile.getName());

        JsonNode root = new ObjectMapper().readTree(reportFile);
        assertEquals(1, root.get("functions").size());
        JsonNode funcJson = root.get("functions").get(0);
        assertEquals("0x00001000", funcJson.get("entry").asText());
        assertEquals("main", funcJson.get("name").asText());
        assertEquals(2, funcJson.get("blocks").size());
        assertEquals("TRANSITION", funcJson.get("edges").get(0).get("type").asText());
        assertEquals("0x00002000", funcJson.get("callSites").get(0).get("target").asText());
        assertEquals("0x00001020", funcJson.get("returnSites").get(0).asText());
        assertTrue(funcJson.get("hasReturn").asBoolean());
        assertEquals(16, funcJson.get("arguments").get("registers").get(0).asInt());
        assertEquals(4, funcJson.get("arguments").get("stack").get(0).asLong());
        assertEquals(8, funcJson.get("frame").get("spDifference").asLong());
        assertFalse(funcJson.get("frame").get("bpOnStack").asBoolean());

        JsonNode edge = root.get("callGraph").get(0);
        assertEquals("0x00001000", edge.get("caller").asText());
        assertEquals("0x00002000", edge.get("callee").asText());
    }

    @Test
    public void testUnnamedFunction() {
        var registry = new FunctionRegistry();
        registry.returnFrom(Address.of(0x1000), Address.of(0x1000));

        var json = new RegistryReporter().generateRegistryJson(registry);
        assertTrue(json.get("functions").get(0).get("name").isNull());
        assertEquals(0, json.get("callGraph").size());
    }
}
