package org.autosemi.astnode;

import org.autosemi.astvisitor.Visitor;

/**
 * The DeclarationNode class represents `let [mut] name [: Type] [= initializer]`.
 */
public class DeclarationNode extends AbstractNode {
    public final String name;
    public final boolean mutable;
    /**
     * The declared type as written, or null.
     */
    public final String type;
    /**
     * The initializer expression, or null.
     */
    public final Node initializer;

    public DeclarationNode(String name, boolean mutable, String type, Node initializer, int tokenIndex) {
        this.name = name;
        this.mutable = mutable;
        this.type = type;
        this.initializer = initializer;
        this.tokenIndex = tokenIndex;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
