package work.diplomacy.kernel.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.diplomacy.kernel.bundle.AutoBundle;
import work.diplomacy.kernel.bundle.BoundaryPort;
import work.diplomacy.kernel.node.BaseNode;
import work.diplomacy.kernel.node.Dangle;
import work.diplomacy.kernel.node.HalfEdge;
import work.diplomacy.kernel.node.ResolvedLink;
import work.diplomacy.kernel.node.Signal;

/**
 * Instantiates lazy modules bottom-up, pairing dangles that meet inside a module and promoting
 * the rest to boundary ports.
 */
public final class ModuleInstantiator {
    private static final Logger log = LoggerFactory.getLogger(ModuleInstantiator.class);

    private final ElaborationContext ctx;

    ModuleInstantiator(ElaborationContext ctx) {
        this.ctx = ctx;
    }

    Instantiation instantiate(LazyModule module) {
        if (module.state() != ModuleState.DECLARED) {
            throw new DoubleApplicationException(module.name() + " instantiated twice (state " + module.state() + ")", module);
        }
        var open = ctx.current();
        if (open.isPresent()) {
            throw new ScopeViolationException(module.name() + " was instantiated before " + open.get().name() + " was closed", open.get());
        }
        module.transition(ModuleState.INSTANTIATING);

        List<Dangle> childDangles = new ArrayList<>();
        for (LazyModule child : module.children()) {
            Instantiation childResult = instantiate(child);
            finishInstantiate(child);
            childDangles.addAll(childResult.dangles());
        }

        List<Dangle> allDangles = new ArrayList<>();
        for (BaseNode node : module.nodes()) {
            allDangles.addAll(node.instantiate());
        }
        allDangles.addAll(childDangles);

        Map<HalfEdge, List<Dangle>> pairing = new TreeMap<>();
        for (Dangle dangle : allDangles) {
            pairing.computeIfAbsent(dangle.source(), key -> new ArrayList<>()).add(dangle);
        }

        List<Dangle> forward = new ArrayList<>();
        List<ResolvedLink> links = new ArrayList<>();
        for (var group : pairing.entrySet()) {
            List<Dangle> ends = group.getValue();
            switch (ends.size()) {
                case 1 -> forward.add(ends.get(0));
                case 2 -> links.add(pair(module, group.getKey(), ends.get(0), ends.get(1)));
                default -> throw new ConnectionDirectionException(
                    ends.size() + " dangles share source " + group.getKey() + " in " + module.name() + ": " + names(ends),
                    module
                );
            }
        }

        AutoBundle auto = AutoBundle.of(forward.stream()
            .map(d -> new AutoBundle.Entry(d.name(), d.data(), d.flipped()))
            .toList());
        List<BoundaryPort> ports = auto.ports();
        List<Dangle> dangles = new ArrayList<>(forward.size());
        for (int i = 0; i < forward.size(); i++) {
            Dangle dangle = forward.get(i);
            Signal io = ports.get(i).signal();
            if (dangle.flipped()) {
                dangle.data().connect(io);
            } else {
                io.connect(dangle.data());
            }
            dangles.add(dangle.withData(io).withName(module.name() + "_" + dangle.name()));
        }

        module.runDeferred();
        var result = new Instantiation(auto, dangles, links);
        module.complete(result);
        log.debug("Instantiated {} (#{}): {} ports, {} links", module.name(), module.id(), auto.size(), links.size());
        return result;
    }

    /**
     * Second pass over a module's own nodes once the module has been wired.
     */
    void finishInstantiate(LazyModule module) {
        for (BaseNode node : module.nodes()) {
            node.finishInstantiate();
        }
    }

    private static ResolvedLink pair(LazyModule module, HalfEdge key, Dangle a, Dangle b) {
        if (a.flipped() == b.flipped()) {
            String role = a.flipped() ? "receive" : "supply";
            throw new ConnectionDirectionException(
                "Dangles " + a.name() + " and " + b.name() + " both " + role + " on source " + key + " in " + module.name(),
                module
            );
        }
        Dangle receiver = a.flipped() ? a : b;
        Dangle supplier = a.flipped() ? b : a;
        receiver.data().connect(supplier.data());
        return new ResolvedLink(key, receiver, supplier);
    }

    private static List<String> names(List<Dangle> dangles) {
        return dangles.stream().map(Dangle::name).toList();
    }
}
