package de.upb.sse.reorg.transform.modules;

import de.upb.sse.reorg.ast.ConstItem;
import de.upb.sse.reorg.ast.ForeignItem;
import de.upb.sse.reorg.ast.Item;
import de.upb.sse.reorg.ast.TyAliasItem;
import de.upb.sse.reorg.ast.UseItem;
import de.upb.sse.reorg.ast.UseTree;

import java.util.Collection;
import java.util.List;

/**
 * Decides when two items are the same declaration for merging purposes.
 * Structural equality alone misses many duplicates, so a few looser rules
 * are layered on top.
 */
public final class ItemEquivalence {
    private final List<String> relativeSegments;

    public ItemEquivalence(Collection<String> relativeSegments) {
        this.relativeSegments = List.copyOf(relativeSegments);
    }

    public boolean compareItems(Item newItem, Item moduleItem) {
        if (newItem.nodeEquivalent(moduleItem) && newItem.getIdent().equals(moduleItem.getIdent())) {
            return true;
        }

        // The translator names anonymous types `unnamed`, `unnamed_0`, ... in
        // each header, so aliases and constants coming from two headers can
        // differ only in that generated name. Same name is taken as same item;
        // the underlying types are not checked.
        if (newItem instanceof TyAliasItem && moduleItem instanceof TyAliasItem) {
            return newItem.getIdent().equals(moduleItem.getIdent());
        }
        if (newItem instanceof ConstItem && moduleItem instanceof ConstItem) {
            return newItem.getIdent().equals(moduleItem.getIdent());
        }

        if (newItem instanceof UseItem && moduleItem instanceof UseItem) {
            UseTree a = ((UseItem) newItem).getTree().normalized(relativeSegments);
            UseTree b = ((UseItem) moduleItem).getTree().normalized(relativeSegments);
            return a.equals(b);
        }
        return false;
    }

    public boolean compareForeignItems(ForeignItem a, ForeignItem b) {
        return a.nodeEquivalent(b) && a.getIdent().equals(b.getIdent());
    }
}
