package org.autosemi.astnode;

import org.autosemi.astvisitor.Visitor;

/**
 * The StringNode class represents a string literal with escapes already processed.
 */
public class StringNode extends AbstractNode {
    public final String value;

    public StringNode(String value, int tokenIndex) {
        this.value = value;
        this.tokenIndex = tokenIndex;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
