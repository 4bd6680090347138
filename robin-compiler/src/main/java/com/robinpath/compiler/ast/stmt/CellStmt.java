package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 文档单元：{@code ---cell <type> [id:x] [k:v]...---} ... {@code ---end---}
 *
 * <p>code 单元的内容解析为 body；其他单元的内容原样保存在 rawBody。</p>
 */
public class CellStmt extends Statement {
    public static final String CODE = "code";

    private String cellType;
    private Map<String, String> meta;
    private List<Statement> body;
    private String rawBody;

    public CellStmt(CodePosition position, String cellType, Map<String, String> meta,
                    List<Statement> body, String rawBody) {
        super(position);
        this.cellType = cellType;
        this.meta = meta != null ? meta : new LinkedHashMap<String, String>();
        this.body = body;
        this.rawBody = rawBody;
    }

    public String getCellType() {
        return cellType;
    }

    public void setCellType(String cellType) {
        this.cellType = cellType;
    }

    public Map<String, String> getMeta() {
        return meta;
    }

    public void setMeta(Map<String, String> meta) {
        this.meta = meta;
    }

    public List<Statement> getBody() {
        return body;
    }

    public void setBody(List<Statement> body) {
        this.body = body;
    }

    public String getRawBody() {
        return rawBody;
    }

    public void setRawBody(String rawBody) {
        this.rawBody = rawBody;
    }

    public boolean isCode() {
        return CODE.equals(cellType);
    }

    @Override
    public int getHeaderEndRow() {
        return position.getStartRow();
    }

    @Override
    public boolean isBlock() {
        return isCode() && body != null;
    }

    @Override
    public String getKind() {
        return "cell";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCell(this, context);
    }
}
