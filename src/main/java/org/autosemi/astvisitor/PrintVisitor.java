package org.autosemi.astvisitor;

import org.autosemi.astnode.*;

import java.util.List;

/*
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   node.accept(printVisitor);
 *   return printVisitor.getResult();
 */
public class PrintVisitor implements Visitor {
    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    public String getResult() {
        return sb.toString();
    }

    private void visitChild(String label, Node child) {
        appendIndent();
        sb.append(label).append(":\n");
        indentLevel++;
        if (child == null) {
            appendIndent();
            sb.append("null\n");
        } else {
            child.accept(this);
        }
        indentLevel--;
    }

    private void visitElements(List<Node> elements) {
        indentLevel++;
        for (Node element : elements) {
            if (element == null) {
                appendIndent();
                sb.append("null\n");
            } else {
                element.accept(this);
            }
        }
        indentLevel--;
    }

    @Override
    public void visit(BlockNode node) {
        appendIndent();
        sb.append("BlockNode:");
        if (node.hasTail) {
            sb.append(" tail");
        }
        sb.append("\n");
        visitElements(node.elements);
    }

    @Override
    public void visit(OperatorNode node) {
        appendIndent();
        sb.append("OperatorNode: ").append(node.operator)
                .append("  pos:").append(node.tokenIndex).append("\n");
        if (node.operand != null) {
            indentLevel++;
            node.operand.accept(this);
            indentLevel--;
        }
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        appendIndent();
        sb.append("BinaryOperatorNode: ").append(node.operator).append("  pos:").append(node.tokenIndex).append("\n");
        indentLevel++;
        if (node.left == null) {
            appendIndent();
            sb.append("null\n");
        } else {
            node.left.accept(this);
        }
        if (node.right == null) {
            appendIndent();
            sb.append("null\n");
        } else {
            node.right.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(IdentifierNode node) {
        appendIndent();
        sb.append("IdentifierNode: ").append(node.name).append("\n");
    }

    @Override
    public void visit(NumberNode node) {
        appendIndent();
        sb.append("NumberNode: ").append(node.value).append("\n");
    }

    @Override
    public void visit(StringNode node) {
        appendIndent();
        sb.append("StringNode: '").append(node.value).append("'\n");
    }

    @Override
    public void visit(ListNode node) {
        appendIndent();
        sb.append("ListNode:\n");
        visitElements(node.elements);
    }

    @Override
    public void visit(ArrayLiteralNode node) {
        appendIndent();
        sb.append("ArrayLiteralNode:\n");
        visitElements(node.elements);
    }

    @Override
    public void visit(DeclarationNode node) {
        appendIndent();
        sb.append("DeclarationNode: ").append(node.mutable ? "let mut " : "let ").append(node.name);
        if (node.type != null) {
            sb.append(": ").append(node.type);
        }
        sb.append("  pos:").append(node.tokenIndex).append("\n");
        if (node.initializer != null) {
            indentLevel++;
            node.initializer.accept(this);
            indentLevel--;
        }
    }

    @Override
    public void visit(IfNode node) {
        appendIndent();
        sb.append("IfNode:\n");
        indentLevel++;
        visitChild("Condition", node.condition);
        visitChild("Then", node.thenBranch);
        if (node.elseBranch != null) {
            visitChild("Else", node.elseBranch);
        }
        indentLevel--;
    }

    @Override
    public void visit(LoopNode node) {
        appendIndent();
        sb.append(node.condition == null ? "LoopNode: loop\n" : "LoopNode: while\n");
        indentLevel++;
        if (node.condition != null) {
            visitChild("Condition", node.condition);
        }
        visitChild("Body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(ForNode node) {
        appendIndent();
        sb.append("ForNode: ").append(node.variable).append("\n");
        indentLevel++;
        visitChild("Iterable", node.iterable);
        visitChild("Body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(FunctionNode node) {
        appendIndent();
        sb.append("FunctionNode: ").append(node.name == null ? "<anon>" : node.name)
                .append("(").append(String.join(", ", node.parameters)).append(")");
        if (node.returnType != null) {
            sb.append(" -> ").append(node.returnType);
        }
        sb.append("\n");
        indentLevel++;
        node.body.accept(this);
        indentLevel--;
    }
}
