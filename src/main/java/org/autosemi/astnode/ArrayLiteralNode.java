package org.autosemi.astnode;

import org.autosemi.astvisitor.Visitor;

import java.util.List;

/**
 * The ArrayLiteralNode class represents `[a, b, c]`.
 */
public class ArrayLiteralNode extends AbstractNode {
    public final List<Node> elements;

    public ArrayLiteralNode(List<Node> elements, int tokenIndex) {
        this.elements = elements;
        this.tokenIndex = tokenIndex;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
