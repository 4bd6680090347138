package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.IntoTarget;
import com.robinpath.compiler.ast.expr.Expression;
import com.robinpath.compiler.ast.expr.NamedArgsExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * 命令调用
 */
public class CommandStmt extends Statement {

    /** 参数书写风格 */
    public enum SyntaxType {
        SPACE("space"),
        PARENTHESES("parentheses"),
        NAMED_PARENTHESES("named-parentheses"),
        MULTILINE_PARENTHESES("multiline-parentheses");

        private final String label;

        SyntaxType(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }

        public static SyntaxType fromLabel(String label) {
            for (SyntaxType t : values()) {
                if (t.label.equals(label)) return t;
            }
            throw new IllegalArgumentException("Unknown syntax type: " + label);
        }
    }

    private String name;
    private String module;
    private List<Expression> args;
    private IntoTarget into;
    private SyntaxType syntaxType;
    private DoStmt callback;

    public CommandStmt(CodePosition position, String name, String module, List<Expression> args,
                       IntoTarget into, SyntaxType syntaxType, DoStmt callback) {
        super(position);
        this.name = name;
        this.module = module;
        this.args = args != null ? args : new ArrayList<Expression>();
        this.into = into;
        this.syntaxType = syntaxType != null ? syntaxType : SyntaxType.SPACE;
        this.callback = callback;
    }

    public CommandStmt(CodePosition position, String name, List<Expression> args) {
        this(position, name, null, args, null, SyntaxType.SPACE, null);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getModule() {
        return module;
    }

    public void setModule(String module) {
        this.module = module;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public void setArgs(List<Expression> args) {
        this.args = args;
    }

    /** 位置参数（不含命名参数） */
    public List<Expression> getPositionalArgs() {
        List<Expression> result = new ArrayList<Expression>();
        for (Expression arg : args) {
            if (arg != null && !(arg instanceof NamedArgsExpr)) result.add(arg);
        }
        return result;
    }

    public NamedArgsExpr getNamedArgs() {
        for (Expression arg : args) {
            if (arg instanceof NamedArgsExpr) return (NamedArgsExpr) arg;
        }
        return null;
    }

    public IntoTarget getInto() {
        return into;
    }

    public void setInto(IntoTarget into) {
        this.into = into;
    }

    public SyntaxType getSyntaxType() {
        return syntaxType;
    }

    public void setSyntaxType(SyntaxType syntaxType) {
        this.syntaxType = syntaxType;
    }

    /** with ... endwith 回调，复用 do 节点表示 */
    public DoStmt getCallback() {
        return callback;
    }

    public void setCallback(DoStmt callback) {
        this.callback = callback;
    }

    @Override
    public int getHeaderEndRow() {
        if (callback != null && callback.getPosition() != null) {
            return callback.getPosition().getStartRow();
        }
        return super.getHeaderEndRow();
    }

    @Override
    public boolean isBlock() {
        return callback != null;
    }

    @Override
    public String getKind() {
        return "command";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCommand(this, context);
    }
}
