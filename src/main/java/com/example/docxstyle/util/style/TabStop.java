package com.example.docxstyle.util.style;

import lombok.Builder;
import lombok.Value;

/**
 * 制表位：position 单位为twip，alignment 为 left/center/right/decimal/bar/clear
 */
@Value
@Builder
public class TabStop {

    int position;
    String alignment;
    String leader;

    public boolean isClear() {
        return "clear".equals(alignment);
    }

    public boolean isRight() {
        return "right".equals(alignment) || "end".equals(alignment);
    }

    public boolean hasLeader() {
        return leader != null && !"none".equals(leader);
    }
}
