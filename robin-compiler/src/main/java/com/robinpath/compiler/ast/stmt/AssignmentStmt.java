package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.LiteralType;
import com.robinpath.compiler.ast.PathSegment;

import java.util.ArrayList;
import java.util.List;

/**
 * 赋值语句：{@code [set ]$target[.path] [=|as] value}
 *
 * <p>值来源按优先级：{@code isLastValue} &gt; {@code command} &gt; {@code literalValue}。
 * literalValue 可以合法地为 null，因此用 {@link #hasLiteralValue()} 区分"未设置"。</p>
 */
public class AssignmentStmt extends Statement {
    private String targetName;
    private List<PathSegment> targetPath = new ArrayList<PathSegment>();
    private boolean set;
    private boolean implicit;
    private boolean hasAs;
    private boolean lastValue;
    private CommandStmt command;
    private Object literalValue;
    private boolean literalPresent;
    private LiteralType literalValueType;

    public AssignmentStmt(CodePosition position, String targetName) {
        super(position);
        this.targetName = targetName;
    }

    public String getTargetName() {
        return targetName;
    }

    public void setTargetName(String targetName) {
        this.targetName = targetName;
    }

    public List<PathSegment> getTargetPath() {
        return targetPath;
    }

    public void setTargetPath(List<PathSegment> targetPath) {
        this.targetPath = targetPath != null ? targetPath : new ArrayList<PathSegment>();
    }

    public boolean isSet() {
        return set;
    }

    public void setSet(boolean set) {
        this.set = set;
    }

    public boolean isImplicit() {
        return implicit;
    }

    public void setImplicit(boolean implicit) {
        this.implicit = implicit;
    }

    public boolean isHasAs() {
        return hasAs;
    }

    public void setHasAs(boolean hasAs) {
        this.hasAs = hasAs;
    }

    public boolean isLastValue() {
        return lastValue;
    }

    public void setLastValue(boolean lastValue) {
        this.lastValue = lastValue;
    }

    public CommandStmt getCommand() {
        return command;
    }

    public void setCommand(CommandStmt command) {
        this.command = command;
    }

    public Object getLiteralValue() {
        return literalValue;
    }

    public void setLiteralValue(Object literalValue) {
        this.literalValue = literalValue;
        this.literalPresent = true;
    }

    public void clearLiteralValue() {
        this.literalValue = null;
        this.literalPresent = false;
    }

    public boolean hasLiteralValue() {
        return literalPresent;
    }

    public LiteralType getLiteralValueType() {
        return literalValueType;
    }

    public void setLiteralValueType(LiteralType literalValueType) {
        this.literalValueType = literalValueType;
    }

    @Override
    public String getKind() {
        return "assignment";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignment(this, context);
    }
}
