package work.diplomacy.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.diplomacy.kernel.support.ElaborationTestSupport;

class DesignLoaderTest {
    @Test
    void loadsNestedDesignFile() {
        var spec = DesignLoader.loadFromFile(ElaborationTestSupport.design("soc.yaml"));

        assertEquals("soc", spec.name());
        assertEquals(Optional.of("Soc"), spec.moduleType());
        assertEquals(List.of("cpu", "ram"), spec.modules().stream().map(DesignSpec::name).toList());
        assertEquals(new DesignSpec.Node("mem", "source", "UInt<32>"), spec.modules().get(0).nodes().get(0));
        assertEquals(List.of(new DesignSpec.Connection("cpu.mem", "ram.port")), spec.connections());
    }

    @Test
    void nodeTypeDefaultsToUInt() throws IOException {
        var spec = parse("design:\n  name: d\n  nodes:\n    - {name: x, kind: sink}\n");
        assertEquals("UInt", spec.nodes().get(0).type());
        assertTrue(spec.moduleType().isEmpty());
        assertTrue(spec.modules().isEmpty());
    }

    @Test
    void rejectsMissingDesignEntry() {
        var error = assertThrows(IOException.class, () -> parse("name: nothing\n"));
        assertTrue(error.getMessage().contains("design"));
    }

    @Test
    void rejectsNonListSections() {
        var error = assertThrows(IOException.class, () -> parse("design:\n  name: d\n  nodes: x\n"));
        assertTrue(error.getMessage().contains("'nodes'"));
    }

    @Test
    void fileErrorsNameTheFile() {
        var error = assertThrows(IllegalStateException.class,
            () -> DesignLoader.loadFromFile(ElaborationTestSupport.design("invalid.yaml")));
        assertTrue(error.getMessage().contains("invalid.yaml"));
        assertTrue(error.getMessage().contains("Missing 'name'"));
    }

    private static DesignSpec parse(String yaml) throws IOException {
        return DesignLoader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }
}
