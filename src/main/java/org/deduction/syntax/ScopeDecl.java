package org.deduction.syntax;

import lombok.Getter;

/**
 * 解析器分配的作用域声明。根作用域编号为 0，父编号为 -1。
 * SHOW 作用域记录其 Show 头部行号。
 */
@Getter
public final class ScopeDecl {

    public static final int NO_PARENT = -1;

    private final int id;
    private final int parentId;
    private final ScopeKind kind;
    private final int showLine;

    public ScopeDecl(int id, int parentId, ScopeKind kind, int showLine) {
        this.id = id;
        this.parentId = parentId;
        this.kind = kind;
        this.showLine = showLine;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ScopeDecl that = (ScopeDecl) o;
        return id == that.id && parentId == that.parentId && kind == that.kind && showLine == that.showLine;
    }

    @Override
    public int hashCode() {
        return ((id * 31 + parentId) * 31 + kind.hashCode()) * 31 + showLine;
    }

    @Override
    public String toString() {
        return kind + "#" + id + "(parent " + parentId + ")";
    }
}
