package com.robinpath.compiler.ast;

import com.robinpath.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * 装饰器行：{@code @name arg...}，位于 def / on 之前
 */
public class Decorator {
    private String name;
    private List<Expression> args;
    private CodePosition position;

    public Decorator(String name, List<Expression> args, CodePosition position) {
        this.name = name;
        this.args = args != null ? args : new ArrayList<Expression>();
        this.position = position;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public void setArgs(List<Expression> args) {
        this.args = args;
    }

    public CodePosition getPosition() {
        return position;
    }

    public void setPosition(CodePosition position) {
        this.position = position;
    }
}
