package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.ForeignItem;
import de.upb.sse.reorg.ast.ForeignModItem;
import de.upb.sse.reorg.ast.Item;
import de.upb.sse.reorg.ast.NodeId;
import de.upb.sse.reorg.ast.SimplePath;
import de.upb.sse.reorg.ast.UseItem;
import de.upb.sse.reorg.ast.UseTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Rewrites the imports of one module to the moved paths. Imports that now
 * point into the module itself are dropped; single-name imports sharing a
 * prefix are collected and re-emitted as one grouped import, e.g.
 * {@code use foo_h::a; use foo_h::b;} becomes {@code use foo::{a, b};}.
 * Imports whose path no move touched are kept exactly as written.
 */
final class ImportRewriter {
    private static final Logger logger = Logger.getLogger(ImportRewriter.class.getName());

    /** null for the crate root */
    private final NodeId moduleId;
    private final String moduleName;
    private final List<Item> items;
    private final ReorganizeContext cx;
    /** prefix -> names imported from it, e.g. [foo] -> [item, item2, item3] */
    private final Map<SimplePath, SortedSet<String>> seenPaths =
            new TreeMap<>(Comparator.comparing(SimplePath::toString));

    ImportRewriter(NodeId moduleId, String moduleName, List<Item> items, ReorganizeContext cx) {
        this.moduleId = moduleId;
        this.moduleName = moduleName;
        this.items = items;
        this.cx = cx;
    }

    /**
     * Returns the items with local imports dropped, mergeable imports
     * removed (and remembered) and every other moved import rewritten.
     */
    List<Item> rewrite() {
        List<Item> out = new ArrayList<>(items.size());
        for (Item item : items) {
            if (!(item instanceof UseItem)) {
                out.add(item);
                continue;
            }
            UseItem use = (UseItem) item;
            Optional<PathRecord> record = cx.pathRecord(use.getId());
            // the record path has self/super stripped, it only means the same
            // thing once a header module in it was replaced
            if (record.isEmpty() || !record.get().isPatched()) {
                out.add(use);
                continue;
            }
            if (record.get().getDestination().equals(moduleId)) {
                logger.fine(() -> "Dropping import of local items in " + moduleName + ": " + use.getTree());
                cx.getStats().incrementDroppedImports();
                continue;
            }
            UseTree tree = use.getTree().withPrefix(record.get().getPath());
            if (!absorb(tree)) {
                out.add(use.withTree(tree));
            }
        }
        return out;
    }

    /**
     * Remembers the names {@code tree} imports if it can be merged into a
     * grouped import.
     *
     * @return true if the import was absorbed and must not be kept
     */
    private boolean absorb(UseTree tree) {
        SimplePath prefix = tree.getPrefix();
        switch (tree.getKind()) {
            case NESTED:
                if (prefix.isEmpty() || !tree.getNested().stream().allMatch(UseTree::isPlainName)) {
                    return false;
                }
                SortedSet<String> names = namesFor(prefix);
                for (UseTree sub : tree.getNested()) {
                    names.add(sub.getPrefix().first());
                }
                return true;
            case SIMPLE:
                // one-segment imports like `use libc;` stay as they are
                if (tree.hasRename() || prefix.size() <= 1) {
                    return false;
                }
                namesFor(prefix.parent()).add(prefix.last());
                return true;
            case GLOB:
            default:
                return false;
        }
    }

    private SortedSet<String> namesFor(SimplePath prefix) {
        return seenPaths.computeIfAbsent(prefix, p -> new TreeSet<>());
    }

    /**
     * Builds one grouped import per collected prefix, leaving out names that
     * {@code retained} declares locally.
     */
    List<Item> groupedImports(List<Item> retained) {
        Set<String> localNames = localNames(retained);
        List<Item> imports = new ArrayList<>();
        for (Map.Entry<SimplePath, SortedSet<String>> e : seenPaths.entrySet()) {
            List<String> names = new ArrayList<>();
            for (String name : e.getValue()) {
                if (!localNames.contains(name)) {
                    names.add(name);
                }
            }
            if (names.isEmpty()) {
                continue;
            }
            imports.add(cx.getBuilder().useMultipleItem(e.getKey(), names));
            cx.getStats().incrementGroupedImports();
        }
        return imports;
    }

    private static Set<String> localNames(List<Item> items) {
        Set<String> names = new HashSet<>();
        for (Item item : items) {
            if (item instanceof UseItem) {
                continue;
            }
            if (item.hasIdent()) {
                names.add(item.getIdent());
            }
            if (item instanceof ForeignModItem) {
                for (ForeignItem fi : ((ForeignModItem) item).getItems()) {
                    names.add(fi.getIdent());
                }
            }
        }
        return names;
    }
}
