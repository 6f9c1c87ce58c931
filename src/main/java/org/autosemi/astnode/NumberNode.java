package org.autosemi.astnode;

import org.autosemi.astvisitor.Visitor;

/**
 * The NumberNode class represents a numeric literal, kept as written minus `_` separators.
 */
public class NumberNode extends AbstractNode {
    public final String value;

    public NumberNode(String value, int tokenIndex) {
        this.value = value;
        this.tokenIndex = tokenIndex;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
