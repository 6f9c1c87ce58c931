package org.autosemi.astnode;

import org.autosemi.astvisitor.Visitor;

/**
 * The IdentifierNode class represents a name, including the literals `true`, `false` and `nil`.
 */
public class IdentifierNode extends AbstractNode {
    /**
     * The identifier name represented by this node.
     */
    public String name;

    public IdentifierNode(String name, int tokenIndex) {
        this.name = name;
        this.tokenIndex = tokenIndex;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
