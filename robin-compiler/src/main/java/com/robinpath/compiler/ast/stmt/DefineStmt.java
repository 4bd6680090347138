package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.Decorator;

import java.util.ArrayList;
import java.util.List;

/**
 * 函数定义：{@code def name $a $b ... enddef}。position 从 def 行开始，不含装饰器。
 */
public class DefineStmt extends BlockStatement {
    private String name;
    private List<String> paramNames;
    private List<Decorator> decorators;
    private List<Statement> body;

    public DefineStmt(CodePosition position, String name, List<String> paramNames,
                      List<Decorator> decorators, List<Statement> body) {
        super(position);
        this.name = name;
        this.paramNames = paramNames != null ? paramNames : new ArrayList<String>();
        this.decorators = decorators != null ? decorators : new ArrayList<Decorator>();
        this.body = body != null ? body : new ArrayList<Statement>();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getParamNames() {
        return paramNames;
    }

    public void setParamNames(List<String> paramNames) {
        this.paramNames = paramNames;
    }

    public List<Decorator> getDecorators() {
        return decorators;
    }

    public void setDecorators(List<Decorator> decorators) {
        this.decorators = decorators;
    }

    public List<Statement> getBody() {
        return body;
    }

    public void setBody(List<Statement> body) {
        this.body = body;
    }

    @Override
    public int getExtentStartRow() {
        int row = super.getExtentStartRow();
        for (Decorator d : decorators) {
            if (d.getPosition() != null) {
                row = Math.min(row, d.getPosition().getStartRow());
            }
        }
        return row;
    }

    @Override
    public String getKind() {
        return "define";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDefine(this, context);
    }
}
