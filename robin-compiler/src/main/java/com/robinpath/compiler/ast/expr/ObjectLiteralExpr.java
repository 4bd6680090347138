package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 结构化对象字面量 {@code {key: value, ...}}，保持键的插入顺序
 */
public class ObjectLiteralExpr extends Expression {
    private Map<String, Expression> properties;

    public ObjectLiteralExpr(Map<String, Expression> properties) {
        this.properties = properties != null ? properties : new LinkedHashMap<String, Expression>();
    }

    public Map<String, Expression> getProperties() {
        return properties;
    }

    public void setProperties(Map<String, Expression> properties) {
        this.properties = properties;
    }

    @Override
    public String getKind() {
        return "objectLiteral";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitObjectLiteral(this, context);
    }
}
