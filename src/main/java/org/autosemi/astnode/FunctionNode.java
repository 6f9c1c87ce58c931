package org.autosemi.astnode;

import org.autosemi.astvisitor.Visitor;

import java.util.List;

/**
 * The FunctionNode class represents a function definition `fn name(params) -> T { ... }`
 * or, with a null name, an anonymous function expression.
 */
public class FunctionNode extends AbstractNode {
    public final String name;
    public final List<String> parameters;
    public final String returnType;
    public final BlockNode body;

    public FunctionNode(String name, List<String> parameters, String returnType, BlockNode body, int tokenIndex) {
        this.name = name;
        this.parameters = parameters;
        this.returnType = returnType;
        this.body = body;
        this.tokenIndex = tokenIndex;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
