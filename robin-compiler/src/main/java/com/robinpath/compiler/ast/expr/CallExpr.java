package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 裸函数调用语法糖：{@code callee arg1 arg2}
 */
public class CallExpr extends Expression {
    private String callee;
    private List<Expression> args;

    public CallExpr(String callee, List<Expression> args) {
        this.callee = callee;
        this.args = args != null ? args : new ArrayList<Expression>();
    }

    public String getCallee() {
        return callee;
    }

    public void setCallee(String callee) {
        this.callee = callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public void setArgs(List<Expression> args) {
        this.args = args;
    }

    @Override
    public String getKind() {
        return "call";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }
}
