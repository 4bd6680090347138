package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.IntoTarget;

import java.util.ArrayList;
import java.util.List;

/**
 * do 块：{@code do [$p...] [into $t] ... enddo}。
 * 也用作命令的 with 回调，此时 position 从 with 关键字开始、到 endwith 结束。
 */
public class DoStmt extends BlockStatement {
    private List<String> paramNames;
    private IntoTarget into;
    private List<Statement> body;

    public DoStmt(CodePosition position, List<String> paramNames, IntoTarget into, List<Statement> body) {
        super(position);
        this.paramNames = paramNames != null ? paramNames : new ArrayList<String>();
        this.into = into;
        this.body = body != null ? body : new ArrayList<Statement>();
    }

    public List<String> getParamNames() {
        return paramNames;
    }

    public void setParamNames(List<String> paramNames) {
        this.paramNames = paramNames;
    }

    public IntoTarget getInto() {
        return into;
    }

    public void setInto(IntoTarget into) {
        this.into = into;
    }

    public List<Statement> getBody() {
        return body;
    }

    public void setBody(List<Statement> body) {
        this.body = body;
    }

    @Override
    public String getKind() {
        return "do";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDo(this, context);
    }
}
