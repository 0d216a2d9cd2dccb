package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.Crate;
import de.upb.sse.reorg.ast.Item;
import de.upb.sse.reorg.ast.ModItem;
import de.upb.sse.reorg.ast.NodeId;
import de.upb.sse.reorg.ast.Nodes;

import java.util.List;
import java.util.logging.Logger;

/**
 * Final pass over every module: fixes up imports, removes duplicate items and
 * appends the grouped imports.
 */
final class ModuleCleanup implements ReorganizeStage {
    private static final Logger logger = Logger.getLogger(ModuleCleanup.class.getName());

    @Override
    public String name() {
        return "cleanup";
    }

    @Override
    public Crate apply(Crate krate, ReorganizeContext cx) {
        cx.catalog(krate);
        logger.fine(() -> "Cleaning up " + cx.catalogSize() + " items");
        DuplicateEliminator duplicates = new DuplicateEliminator(cx);
        Crate cleaned = Nodes.foldItems(krate, item -> {
            if (item instanceof ModItem) {
                ModItem module = (ModItem) item;
                return List.of(module.withItems(
                        clean(module.getId(), module.getIdent(), module.getItems(), duplicates, cx)));
            }
            return List.of(item);
        });
        // the crate root is not an item, so the fold never hands it to us
        return cleaned.withItems(clean(null, "crate root", cleaned.getItems(), duplicates, cx));
    }

    private List<Item> clean(NodeId moduleId, String moduleName, List<Item> moduleItems,
                             DuplicateEliminator duplicates, ReorganizeContext cx) {
        ImportRewriter imports = new ImportRewriter(moduleId, moduleName, moduleItems, cx);
        List<Item> items = imports.rewrite();
        items = duplicates.removeDuplicates(moduleName, items);
        items.addAll(imports.groupedImports(items));
        return items;
    }
}
