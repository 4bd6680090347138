package com.robinpath.compiler.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * into 目标：{@code into $name.path[0]}
 */
public class IntoTarget {
    private String targetName;
    private List<PathSegment> targetPath;

    public IntoTarget(String targetName, List<PathSegment> targetPath) {
        this.targetName = targetName;
        this.targetPath = targetPath != null ? targetPath : new ArrayList<PathSegment>();
    }

    public IntoTarget(String targetName) {
        this(targetName, null);
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
        this.targetPath = targetPath;
    }

    public String toSource() {
        StringBuilder sb = new StringBuilder("$").append(targetName);
        for (PathSegment seg : targetPath) {
            sb.append(seg.toSource());
        }
        return sb.toString();
    }
}
