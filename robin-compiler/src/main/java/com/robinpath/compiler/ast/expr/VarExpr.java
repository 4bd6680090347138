package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.PathSegment;

import java.util.ArrayList;
import java.util.List;

/**
 * 变量引用：{@code $name.prop[0]}
 */
public class VarExpr extends Expression {
    private String name;
    private List<PathSegment> path;

    public VarExpr(String name, List<PathSegment> path) {
        this.name = name;
        this.path = path != null ? path : new ArrayList<PathSegment>();
    }

    public VarExpr(String name) {
        this(name, null);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<PathSegment> getPath() {
        return path;
    }

    public void setPath(List<PathSegment> path) {
        this.path = path;
    }

    public boolean hasPath() {
        return path != null && !path.isEmpty();
    }

    @Override
    public String getKind() {
        return "var";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVar(this, context);
    }
}
