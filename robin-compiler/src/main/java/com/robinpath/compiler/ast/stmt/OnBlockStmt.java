package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.Decorator;

import java.util.ArrayList;
import java.util.List;

/**
 * 事件处理块：{@code on "event" ... endon}
 */
public class OnBlockStmt extends BlockStatement {
    private String eventName;
    private List<Decorator> decorators;
    private List<Statement> body;

    public OnBlockStmt(CodePosition position, String eventName, List<Decorator> decorators,
                       List<Statement> body) {
        super(position);
        this.eventName = eventName;
        this.decorators = decorators != null ? decorators : new ArrayList<Decorator>();
        this.body = body != null ? body : new ArrayList<Statement>();
    }

    public String getEventName() {
        return eventName;
    }

    public void setEventName(String eventName) {
        this.eventName = eventName;
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
        return "onBlock";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitOnBlock(this, context);
    }
}
