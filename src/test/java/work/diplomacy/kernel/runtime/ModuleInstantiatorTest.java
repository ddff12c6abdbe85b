package work.diplomacy.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.diplomacy.kernel.bundle.PortDirection;
import work.diplomacy.kernel.demo.DemoNode;
import work.diplomacy.kernel.demo.DemoSignal;
import work.diplomacy.kernel.node.Dangle;
import work.diplomacy.kernel.node.HalfEdge;
import work.diplomacy.kernel.node.ResolvedLink;
import work.diplomacy.kernel.support.ElaborationTestSupport;
import work.diplomacy.kernel.support.ElaborationTestSupport.Block;
import work.diplomacy.kernel.support.ElaborationTestSupport.FixedNode;

class ModuleInstantiatorTest {
    @Test
    void internalConnectionLeavesNoBoundary() {
        var ctx = new ElaborationContext();
        var order = new ArrayList<String>();
        DemoNode[] mem = new DemoNode[1];
        DemoNode[] port = new DemoNode[1];
        var soc = ElaborationTestSupport.block(ctx, "soc", self -> {
            var cpu = ElaborationTestSupport.block(ctx, "cpu", c -> {
                mem[0] = DemoNode.source(ctx, "mem", "UInt<32>");
                c.defer(() -> order.add("cpu"));
            });
            var ram = ElaborationTestSupport.block(ctx, "ram", r -> {
                port[0] = DemoNode.sink(ctx, "port", "UInt<32>");
                r.defer(() -> order.add("ram"));
            });
            self.defer(() -> order.add("soc"));
            port[0].bind(mem[0]);
        });

        var result = soc.instantiate();

        assertTrue(result.auto().isEmpty());
        assertTrue(result.dangles().isEmpty());
        assertEquals(1, result.links().size());
        ResolvedLink link = result.links().get(0);
        assertEquals("cpu_mem", link.supplier().name());
        assertEquals("ram_port", link.receiver().name());
        assertEquals(new HalfEdge(mem[0].serial(), 0), link.key());
        assertEquals("UInt<32>", link.label());
        assertEquals(List.of("cpu", "ram", "soc"), order);
    }

    @Test
    void receiverIsDrivenBySupplier() {
        var ctx = new ElaborationContext();
        DemoNode[] mem = new DemoNode[1];
        DemoNode[] port = new DemoNode[1];
        Block[] ram = new Block[1];
        Block[] cpu = new Block[1];
        var soc = ElaborationTestSupport.block(ctx, "soc", self -> {
            cpu[0] = ElaborationTestSupport.block(ctx, "cpu", c -> mem[0] = DemoNode.source(ctx, "mem", "UInt"));
            ram[0] = ElaborationTestSupport.block(ctx, "ram", r -> port[0] = DemoNode.sink(ctx, "port", "UInt"));
            port[0].bind(mem[0]);
        });
        soc.instantiate();

        var ramPort = ram[0].auto().port("port").orElseThrow();
        var cpuPort = cpu[0].auto().port("mem").orElseThrow();
        assertEquals(PortDirection.INPUT, ramPort.direction());
        assertEquals(PortDirection.OUTPUT, cpuPort.direction());
        assertSame(cpuPort.signal(), ((DemoSignal) ramPort.signal()).driver().orElseThrow());
        assertSame(ramPort.signal(), port[0].signals().get(0).driver().orElseThrow());
        assertSame(mem[0].signals().get(0), ((DemoSignal) cpuPort.signal()).driver().orElseThrow());
    }

    @Test
    void unmatchedLeafEndBecomesABoundaryPort() {
        var ctx = new ElaborationContext();
        var leaf = ElaborationTestSupport.block(ctx, "leaf", self -> DemoNode.source(ctx, "out", "UInt<8>"));

        var result = leaf.instantiate();

        assertEquals(List.of("out"), List.copyOf(result.auto().elements().keySet()));
        var port = result.auto().port("out").orElseThrow();
        assertEquals(PortDirection.OUTPUT, port.direction());
        assertEquals("UInt<8>", port.typeName());
        assertEquals(1, result.dangles().size());
        Dangle dangle = result.dangles().get(0);
        assertEquals("leaf_out", dangle.name());
        assertFalse(dangle.flipped());
        assertSame(port.signal(), dangle.data());
    }

    @Test
    void nestedLeafEndSurfacesOnTheRoot() {
        var ctx = new ElaborationContext();
        var root = ElaborationTestSupport.block(ctx, "root", self ->
            ElaborationTestSupport.block(ctx, "mid", mid ->
                ElaborationTestSupport.block(ctx, "leaf", leaf -> DemoNode.source(ctx, "out", "UInt<8>"))));

        var result = root.instantiate();

        assertEquals(List.of("mid_leaf_out"), List.copyOf(result.auto().elements().keySet()));
        var port = result.auto().port("mid_leaf_out").orElseThrow();
        assertEquals(PortDirection.OUTPUT, port.direction());
        assertEquals("UInt<8>", port.typeName());
        assertEquals(List.of("root_mid_leaf_out"), result.dangles().stream().map(Dangle::name).toList());
        assertTrue(result.links().isEmpty());
    }

    @Test
    void boundaryFollowsCanonicalOrder() {
        var ctx = new ElaborationContext();
        var top = ElaborationTestSupport.block(ctx, "top", self -> {
            ElaborationTestSupport.block(ctx, "c", c -> DemoNode.sink(ctx, "y", "UInt"));
            DemoNode.source(ctx, "x", "UInt");
        });

        var result = top.instantiate();

        assertEquals(List.of("c_y", "x"), List.copyOf(result.auto().elements().keySet()));
        assertEquals(List.of("top_c_y", "top_x"), result.dangles().stream().map(Dangle::name).toList());
    }

    @Test
    void duplicatePortNamesAreRenumbered() {
        var ctx = new ElaborationContext();
        var module = ElaborationTestSupport.block(ctx, "m", self -> {
            DemoNode.source(ctx, "a_0", "UInt");
            DemoNode.source(ctx, "a_0", "UInt");
            DemoNode.source(ctx, "b", "UInt");
            DemoNode.source(ctx, "a_0_1", "UInt");
        });

        var result = module.instantiate();

        assertEquals(List.of("a_0", "a_1", "b", "a_2"), List.copyOf(result.auto().elements().keySet()));
        assertEquals(List.of("m_a_0", "m_a_0", "m_b", "m_a_0_1"), result.dangles().stream().map(Dangle::name).toList());
    }

    @Test
    void pairWithSameOrientationIsRejected() {
        var ctx = new ElaborationContext();
        var key = new HalfEdge(100, 0);
        var module = ElaborationTestSupport.block(ctx, "bad", self -> self.register(new FixedNode(100, "twins", List.of(
            new Dangle(key, key, false, "left", new DemoSignal("UInt")),
            new Dangle(key, key, false, "right", new DemoSignal("UInt"))
        ))));

        var error = assertThrows(ConnectionDirectionException.class, module::instantiate);
        assertEquals("connection_direction", error.code());
        assertTrue(error.getMessage().contains("left"));
    }

    @Test
    void moreThanTwoEndsOnOneSourceIsRejected() {
        var ctx = new ElaborationContext();
        var key = new HalfEdge(7, 0);
        var module = ElaborationTestSupport.block(ctx, "crowded", self -> self.register(new FixedNode(7, "three", List.of(
            new Dangle(key, key, false, "s", new DemoSignal("UInt")),
            new Dangle(key, key, true, "r0", new DemoSignal("UInt")),
            new Dangle(key, key, true, "r1", new DemoSignal("UInt"))
        ))));

        assertThrows(ConnectionDirectionException.class, module::instantiate);
    }

    @Test
    void instantiatingTwiceKeepsTheFirstResult() {
        var ctx = new ElaborationContext();
        var leaf = ElaborationTestSupport.block(ctx, "leaf", self -> DemoNode.source(ctx, "out", "UInt"));
        var first = leaf.instantiate();

        var error = assertThrows(DoubleApplicationException.class, leaf::instantiate);
        assertEquals(Optional.of("leaf"), error.moduleName());
        assertSame(first, leaf.instantiation());
        assertEquals(ModuleState.DONE, leaf.state());
    }

    @Test
    void instantiationWaitsForOpenScopes() {
        var ctx = new ElaborationContext();
        var done = ctx.module("done", new Block(ctx));
        var open = new Block(ctx);

        assertThrows(ScopeViolationException.class, done::instantiate);
        assertEquals(ModuleState.DECLARED, done.state());
        ctx.module(open);
    }

    @Test
    void childNodesAreFinishedAfterTheirModuleIsWired() {
        var ctx = new ElaborationContext();
        DemoNode[] child = new DemoNode[1];
        DemoNode[] own = new DemoNode[1];
        var root = ElaborationTestSupport.block(ctx, "root", self -> {
            ElaborationTestSupport.block(ctx, "c", c -> child[0] = DemoNode.source(ctx, "o", "UInt"));
            own[0] = DemoNode.source(ctx, "p", "UInt");
        });

        root.instantiate();

        assertTrue(child[0].isFinished());
        assertFalse(own[0].isFinished());
    }
}
