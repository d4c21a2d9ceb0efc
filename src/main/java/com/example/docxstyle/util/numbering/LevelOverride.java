package com.example.docxstyle.util.numbering;

import lombok.Value;

/**
 * 编号实例上的级别覆盖（w:lvlOverride）
 *
 * startOverride 只替换起始值；levelDef 非空时为整级替换。
 */
@Value
public class LevelOverride {

    int level;
    Integer startOverride;
    LevelDef levelDef;
}
