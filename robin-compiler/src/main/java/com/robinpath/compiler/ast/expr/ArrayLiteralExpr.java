package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 结构化数组字面量 {@code [a, b]}
 */
public class ArrayLiteralExpr extends Expression {
    private List<Expression> elements;

    public ArrayLiteralExpr(List<Expression> elements) {
        this.elements = elements != null ? elements : new ArrayList<Expression>();
    }

    public List<Expression> getElements() {
        return elements;
    }

    public void setElements(List<Expression> elements) {
        this.elements = elements;
    }

    @Override
    public String getKind() {
        return "arrayLiteral";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayLiteral(this, context);
    }
}
