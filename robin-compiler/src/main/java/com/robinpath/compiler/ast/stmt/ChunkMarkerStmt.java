package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 分块标记：{@code --- chunk:<id> key:value ... ---}
 */
public class ChunkMarkerStmt extends Statement {
    private String id;
    private Map<String, String> meta;

    public ChunkMarkerStmt(CodePosition position, String id, Map<String, String> meta) {
        super(position);
        this.id = id;
        this.meta = meta != null ? meta : new LinkedHashMap<String, String>();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Map<String, String> getMeta() {
        return meta;
    }

    public void setMeta(Map<String, String> meta) {
        this.meta = meta;
    }

    @Override
    public String getKind() {
        return "chunk_marker";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitChunkMarker(this, context);
    }
}
