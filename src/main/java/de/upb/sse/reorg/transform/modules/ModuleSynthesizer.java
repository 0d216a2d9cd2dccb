package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.AstBuilder;
import de.upb.sse.reorg.ast.Crate;
import de.upb.sse.reorg.ast.Item;
import de.upb.sse.reorg.ast.NodeId;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Adds the modules the resolver decided to create (e.g. {@code stdlib}) to
 * the top level of the crate, already filled with their items.
 */
final class ModuleSynthesizer implements ReorganizeStage {
    private static final Logger logger = Logger.getLogger(ModuleSynthesizer.class.getName());

    @Override
    public String name() {
        return "synthesize";
    }

    @Override
    public Crate apply(Crate krate, ReorganizeContext cx) {
        Map<NodeId, List<NodeId>> destModToItems = cx.createDestModMap();
        cx.setDestModToItems(destModToItems);

        List<Item> topLevel = new ArrayList<>(krate.getItems());
        for (Map.Entry<NodeId, List<NodeId>> entry : destModToItems.entrySet()) {
            Optional<String> name = cx.newModuleName(entry.getKey());
            if (name.isEmpty()) {
                continue;
            }
            List<Item> items = new ArrayList<>();
            for (NodeId itemId : entry.getValue()) {
                cx.lookup(itemId).ifPresent(items::add);
            }
            topLevel.add(AstBuilder.newModule(entry.getKey(), name.get(), items));
            cx.getStats().incrementCreatedModules();
            cx.getStats().addMovedItems(items.size());
            logger.fine(() -> "Created module " + name.get() + " with " + items.size() + " items");
        }
        return krate.withItems(topLevel);
    }
}
