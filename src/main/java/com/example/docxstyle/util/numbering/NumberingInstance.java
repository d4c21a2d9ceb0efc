package com.example.docxstyle.util.numbering;

/**
 * 编号实例（w:num）：引用抽象定义，并可按级别覆盖
 */
public class NumberingInstance {

    private final String numId;
    private final String abstractNumId;
    private final LevelOverride[] overrides;

    public NumberingInstance(String numId, String abstractNumId, LevelOverride[] overrides) {
        this.numId = numId;
        this.abstractNumId = abstractNumId;
        this.overrides = new LevelOverride[AbstractNumbering.LEVEL_COUNT];
        if (overrides != null) {
            System.arraycopy(overrides, 0, this.overrides, 0, Math.min(overrides.length, AbstractNumbering.LEVEL_COUNT));
        }
    }

    public String getNumId() { return numId; }

    public String getAbstractNumId() { return abstractNumId; }

    public LevelOverride override(int level) {
        if (level < 0 || level >= AbstractNumbering.LEVEL_COUNT) {
            return null;
        }
        return overrides[level];
    }
}
