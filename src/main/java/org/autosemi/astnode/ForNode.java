package org.autosemi.astnode;

import org.autosemi.astvisitor.Visitor;

/**
 * The ForNode class represents `for variable in iterable { ... }`.
 */
public class ForNode extends AbstractNode {
    public final String variable;
    public final Node iterable;
    public final BlockNode body;

    public ForNode(String variable, Node iterable, BlockNode body, int tokenIndex) {
        this.variable = variable;
        this.iterable = iterable;
        this.body = body;
        this.tokenIndex = tokenIndex;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
