package org.pragmatica.nix.ast;

import java.util.List;

/**
 * Nodes holding bindings: attribute sets and both {@code let} forms.
 */
public interface HasEntry extends AstNode {
    default List<Entry> entries() {
        return childrenOf(Entry.TYPE);
    }

    default List<AttrpathValue> attrpathValues() {
        return childrenOf(AttrpathValue.TYPE);
    }

    default List<Inherit> inherits() {
        return childrenOf(Inherit.TYPE);
    }
}
