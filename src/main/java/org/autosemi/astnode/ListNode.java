package org.autosemi.astnode;

import org.autosemi.astvisitor.Visitor;

import java.util.ArrayList;
import java.util.List;

/**
 * The ListNode class holds a parenthesized, comma separated list: call arguments,
 * tuples and the unit value `()`. An empty ListNode also stands for an empty block.
 */
public class ListNode extends AbstractNode {
    public final List<Node> elements;

    public ListNode(List<Node> elements, int tokenIndex) {
        this.elements = elements;
        this.tokenIndex = tokenIndex;
    }

    public ListNode(int tokenIndex) {
        this(new ArrayList<>(), tokenIndex);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
