package work.diplomacy.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.diplomacy.kernel.support.ElaborationTestSupport;

class ModuleValueTest {
    @Test
    void valueIsAvailableOnceTheModuleIsWired() {
        var ctx = new ElaborationContext();
        List<ModuleValue<String>> values = new ArrayList<>();
        var module = ElaborationTestSupport.block(ctx, "m", self -> values.add(self.deferValue(() -> "wired " + self.name())));
        var value = values.get(0);

        assertFalse(value.isAvailable());
        var error = assertThrows(PrematureAccessException.class, value::get);
        assertTrue(error.getMessage().contains("m"));

        module.instantiate();
        assertTrue(value.isAvailable());
        assertEquals("wired m", value.get());
    }

    @Test
    void inModuleBodyQueuesOnTheInnermostModule() {
        var ctx = new ElaborationContext();
        var ran = new ArrayList<String>();
        List<ModuleValue<Integer>> values = new ArrayList<>();
        var outer = ElaborationTestSupport.block(ctx, "outer", self -> {
            ElaborationTestSupport.block(ctx, "inner", inner -> values.add(ctx.inModuleBody(() -> {
                ran.add("inner");
                return 1;
            })));
            values.add(ctx.inModuleBody(() -> {
                ran.add("outer");
                return 2;
            }));
        });

        outer.instantiate();

        assertEquals(List.of("inner", "outer"), ran);
        assertEquals(1, values.get(0).get());
        assertEquals(2, values.get(1).get());
    }

    @Test
    void deferredBodiesSeeTheirModuleWired() {
        var ctx = new ElaborationContext();
        var observed = new ArrayList<ModuleState>();
        var module = ElaborationTestSupport.block(ctx, "m", self -> self.defer(() -> observed.add(self.state())));
        module.instantiate();
        assertEquals(List.of(ModuleState.INSTANTIATING), observed);
    }

    @Test
    void deferredBodiesRunInRegistrationOrder() {
        var ctx = new ElaborationContext();
        var ran = new ArrayList<Integer>();
        var module = ElaborationTestSupport.block(ctx, "m", self -> {
            self.defer(() -> ran.add(1));
            self.defer(() -> ran.add(2));
            self.defer(() -> ran.add(3));
        });
        module.instantiate();
        assertEquals(List.of(1, 2, 3), ran);
    }
}
