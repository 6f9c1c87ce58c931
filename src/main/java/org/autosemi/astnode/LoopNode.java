package org.autosemi.astnode;

import org.autosemi.astvisitor.Visitor;

/**
 * The LoopNode class represents `while condition { ... }` and `loop { ... }`.
 * The condition is null for `loop`.
 */
public class LoopNode extends AbstractNode {
    public final Node condition;
    public final BlockNode body;

    public LoopNode(Node condition, BlockNode body, int tokenIndex) {
        this.condition = condition;
        this.body = body;
        this.tokenIndex = tokenIndex;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
