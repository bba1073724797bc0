package org.deduction.syntax;

import lombok.Getter;

/**
 * 引用的子证明区间 start-end (闭区间)。
 */
@Getter
public final class LineRange {

    private final int start;
    private final int end;

    private LineRange(int start, int end) {
        if (start <= 0 || end < start) {
            throw new IllegalArgumentException("Invalid line range " + start + "-" + end);
        }
        this.start = start;
        this.end = end;
    }

    public static LineRange of(int start, int end) {
        return new LineRange(start, end);
    }

    public boolean contains(int line) {
        return line >= start && line <= end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LineRange that = (LineRange) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
