package com.example.docxstyle.util.style;

import lombok.Builder;
import lombok.Value;

/**
 * 缩进（单位：twip），null表示未设置
 */
@Value
@Builder(toBuilder = true)
public class Indentation {

    Integer left;
    Integer right;
    Integer firstLine;
    Integer hanging;

    public static final Indentation EMPTY = Indentation.builder().build();

    public boolean isEmpty() {
        return left == null && right == null && firstLine == null && hanging == null;
    }

    /**
     * 逐属性合并，override 中已设置的属性覆盖 base
     */
    public static Indentation merge(Indentation base, Indentation override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        Integer firstLine = override.firstLine;
        Integer hanging = override.hanging;
        // firstLine 与 hanging 互斥：子样式设置其一时清除父样式的另一个
        if (firstLine == null && hanging == null) {
            firstLine = base.firstLine;
            hanging = base.hanging;
        }
        return Indentation.builder()
                .left(override.left != null ? override.left : base.left)
                .right(override.right != null ? override.right : base.right)
                .firstLine(firstLine)
                .hanging(hanging)
                .build();
    }
}
