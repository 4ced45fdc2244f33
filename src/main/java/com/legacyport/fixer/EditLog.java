package com.legacyport.fixer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 规则产生的编辑侧表。
 * 同一起点的替换后写入者生效；与已有替换区间重叠的新替换会淘汰旧替换。插入按产生顺序保留。
 */
final class EditLog {
    private static final Comparator<Edit> POSITION_ORDER = Comparator
        .comparingInt(Edit::start)
        .thenComparingInt(edit -> edit.isInsertion() ? 0 : 1)
        .thenComparingInt(Edit::sequence);

    private final TreeMap<Integer, Edit> replacements = new TreeMap<>();
    private final List<Edit> insertions = new ArrayList<>();
    private final int textLength;
    private int sequence;

    EditLog(int textLength) {
        this.textLength = textLength;
    }

    void replace(int start, int end, String replacement) {
        checkBounds(start, end);
        if (start == end) {
            throw new IllegalArgumentException("替换区间为空，零宽编辑请使用 insert: " + start);
        }
        replacements.entrySet().removeIf(entry -> entry.getValue().overlaps(start, end));
        replacements.put(start, new Edit(start, end, replacement, sequence++));
    }

    void insert(int offset, String text) {
        checkBounds(offset, offset);
        insertions.add(new Edit(offset, offset, text, sequence++));
    }

    int size() {
        return replacements.size() + insertions.size();
    }

    /**
     * 按位置排序的全部编辑：同一偏移处插入先于替换，插入之间按产生顺序。
     */
    List<Edit> edits() {
        List<Edit> all = new ArrayList<>(replacements.size() + insertions.size());
        for (Map.Entry<Integer, Edit> entry : replacements.entrySet()) {
            all.add(entry.getValue());
        }
        all.addAll(insertions);
        all.sort(POSITION_ORDER);
        return List.copyOf(all);
    }

    private void checkBounds(int start, int end) {
        if (start < 0 || end < start || end > textLength) {
            throw new IllegalArgumentException(
                "编辑区间越界: [" + start + ", " + end + "), 文本长度 " + textLength);
        }
    }
}
