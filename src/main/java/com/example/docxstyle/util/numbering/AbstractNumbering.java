package com.example.docxstyle.util.numbering;

/**
 * 抽象编号定义（w:abstractNum），级别用固定9槽数组保存，未定义的级别为null
 */
public class AbstractNumbering {

    public static final int LEVEL_COUNT = 9;

    private final String id;
    private final String multiLevelType;
    private final String styleLink;
    private final String numStyleLink;
    private final LevelDef[] levels;

    public AbstractNumbering(String id, String multiLevelType, String styleLink, String numStyleLink, LevelDef[] levels) {
        this.id = id;
        this.multiLevelType = multiLevelType;
        this.styleLink = styleLink;
        this.numStyleLink = numStyleLink;
        this.levels = new LevelDef[LEVEL_COUNT];
        if (levels != null) {
            System.arraycopy(levels, 0, this.levels, 0, Math.min(levels.length, LEVEL_COUNT));
        }
    }

    public String getId() { return id; }

    public String getMultiLevelType() { return multiLevelType; }

    public String getStyleLink() { return styleLink; }

    public String getNumStyleLink() { return numStyleLink; }

    /**
     * @return 级别定义；越界或未定义时返回null
     */
    public LevelDef level(int level) {
        if (level < 0 || level >= LEVEL_COUNT) {
            return null;
        }
        return levels[level];
    }

    public boolean hasLevels() {
        for (LevelDef def : levels) {
            if (def != null) {
                return true;
            }
        }
        return false;
    }

    public int definedLevelCount() {
        int count = 0;
        for (LevelDef def : levels) {
            if (def != null) {
                count++;
            }
        }
        return count;
    }
}
