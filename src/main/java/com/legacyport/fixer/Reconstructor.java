package com.legacyport.fixer;

import java.util.List;

/**
 * 将原文与编辑按位置合并成最终文本，编辑之外的字符逐字保留。
 */
public final class Reconstructor {

    /**
     * @param text 原文
     * @param edits 按位置排序、替换区间互不重叠的编辑
     * @return 合并后的文本
     */
    public String dump(String text, List<Edit> edits) {
        if (text == null) {
            throw new IllegalArgumentException("原文不能为空");
        }
        if (edits == null || edits.isEmpty()) {
            return text;
        }

        StringBuilder output = new StringBuilder(text.length() + 64);
        int cursor = 0;
        int previousStart = 0;
        for (Edit edit : edits) {
            if (edit.end() > text.length()) {
                throw new IllegalArgumentException("编辑超出原文范围: " + edit);
            }
            if (edit.start() < previousStart) {
                throw new IllegalArgumentException("编辑未按位置排序: " + edit);
            }
            previousStart = edit.start();

            if (edit.start() > cursor) {
                output.append(text, cursor, edit.start());
                cursor = edit.start();
            }
            output.append(edit.replacement());
            if (!edit.isInsertion()) {
                if (edit.start() < cursor) {
                    throw new IllegalArgumentException("替换区间重叠: " + edit);
                }
                cursor = edit.end();
            }
        }
        output.append(text, cursor, text.length());
        return output.toString();
    }
}
