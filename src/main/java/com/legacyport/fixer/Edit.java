package com.legacyport.fixer;

/**
 * 一次待应用的编辑。start == end 表示零宽插入，否则替换 [start, end)。
 * sequence 为记录顺序，用于同一位置多次插入时保持产生顺序。
 */
public record Edit(
    int start,
    int end,
    String replacement,
    int sequence
) {
    public Edit {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("非法编辑区间: [" + start + ", " + end + ")");
        }
        if (replacement == null) {
            throw new IllegalArgumentException("替换文本不能为空");
        }
    }

    public boolean isInsertion() {
        return start == end;
    }

    public boolean overlaps(int otherStart, int otherEnd) {
        return start < otherEnd && otherStart < end;
    }
}
