package component;

/**
 * 누적 줄 수에서 레벨과 낙하 간격을 계산한다.
 * level = lines / linesPerLevel + 1
 * dropInterval = max(min, base - (level - 1) * step)
 * 두 값은 줄 수로부터만 다시 계산되며 따로 설정할 수 없다.
 */
public class SpeedManager {
    private final GameConfig config;
    private int level;
    private int dropInterval; // 현재 블럭 낙하 간격(ms)

    public SpeedManager(GameConfig config) {
        this.config = config;
        resetLevel();
    }

    public int getLevel() {
        return level;
    }

    public int getDropInterval() {
        return dropInterval;
    }

    public static int levelFor(int linesCleared, int linesPerLevel) {
        return linesCleared / linesPerLevel + 1;
    }

    public int intervalFor(int level) {
        return Math.max(config.minDropInterval(),
                config.baseDropInterval() - (level - 1) * config.dropIntervalStep());
    }

    /**
     * 누적 줄 수 변경 시 호출.
     * @return 레벨이 올랐으면 true
     */
    public boolean updateForLines(int linesCleared) {
        int next = levelFor(linesCleared, config.linesPerLevel());
        boolean leveledUp = next > level;
        level = next;
        dropInterval = intervalFor(next);
        return leveledUp;
    }

    /**
     * 레벨/속도 리셋
     */
    public void resetLevel() {
        this.level = 1;
        this.dropInterval = intervalFor(1);
    }

    @Override
    public String toString() {
        return "SpeedManager{level=" + level + ", dropInterval=" + dropInterval + "ms}";
    }
}
