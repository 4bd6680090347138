package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 命名参数集合 {@code $key=value}。只作为命令的最后一个参数出现，由命令打印器展开。
 */
public class NamedArgsExpr extends Expression {
    private Map<String, Expression> args;

    public NamedArgsExpr(Map<String, Expression> args) {
        this.args = args != null ? args : new LinkedHashMap<String, Expression>();
    }

    public Map<String, Expression> getArgs() {
        return args;
    }

    public void setArgs(Map<String, Expression> args) {
        this.args = args;
    }

    @Override
    public String getKind() {
        return "namedArgs";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNamedArgs(this, context);
    }
}
