package de.upb.sse.reorg.ast;

/**
 * Dispatch over the item kinds.
 *
 * @param <R> result type of each visit
 */
public interface ItemVisitor<R> {
    R visitMod(ModItem item);

    R visitUse(UseItem item);

    R visitForeignMod(ForeignModItem item);

    R visitTyAlias(TyAliasItem item);

    R visitConst(ConstItem item);

    R visitOther(OpaqueItem item);
}
