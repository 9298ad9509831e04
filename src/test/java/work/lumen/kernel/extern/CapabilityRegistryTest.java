package work.lumen.kernel.extern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lumen.kernel.demo.TextValue;
import work.lumen.kernel.error.ConfigurationException;
import work.lumen.kernel.error.ExternResolutionException;

class CapabilityRegistryTest {
    private static CapabilityRegistry registry() {
        return new CapabilityRegistry()
            .register("host", "name", args -> new TextValue("host"))
            .register("alt", "name", args -> new TextValue("alt"))
            .register("alt", "only_alt", args -> new TextValue("alt-only"));
    }

    @Test
    void unregisteredBackendIsNamedInTheError() {
        var error = assertThrows(ExternResolutionException.class, () -> registry().invoke("backendX:name", List.of()));
        assertTrue(error.getMessage().contains("backendX"), error.getMessage());
        assertEquals(List.of("backendX"), error.backends());
        assertEquals("extern_resolution_error", error.code());
    }

    @Test
    void namedBackendsAreNeverSubstituted() {
        var error = assertThrows(ExternResolutionException.class, () -> registry().invoke("host:only_alt", List.of()));
        assertTrue(error.getMessage().contains("'host'"), error.getMessage());
    }

    @Test
    void triesBackendsLeftToRight() {
        assertEquals(new TextValue("alt"), registry().invoke("missing|alt|host:name", List.of()));
        assertEquals(new TextValue("host"), registry().invoke("host|alt:name", List.of()));
    }

    @Test
    void bareSelectorUsesFirstProvider() {
        var registry = registry();
        assertEquals(new TextValue("host"), registry.invoke("name", List.of()));
        assertEquals(new TextValue("alt-only"), registry.invoke("only_alt", List.of()));
        assertEquals("alt", registry.resolve(Selector.parse("only_alt")).backend());
    }

    @Test
    void bareSelectorWithoutProviderFails() {
        assertThrows(ExternResolutionException.class, () -> registry().invoke("nothing", List.of()));
    }

    @Test
    void duplicateRegistrationIsRejected() {
        var registry = registry();
        assertThrows(ConfigurationException.class, () -> registry.register("host", "name", args -> new TextValue("x")));
        assertThrows(ConfigurationException.class, () -> registry.register("bad name", "x", args -> new TextValue("x")));
    }
}
