package logic;

import component.GameConfig;

/** 줄 제거 / 하드드롭 점수 정책 */
public class ScoreService {

    private final GameConfig config;

    public ScoreService(GameConfig config) {
        this.config = config;
    }

    /** lines * pointsPerLine * level */
    public int lineClearScore(int lines, int level) {
        return lines * config.pointsPerLine() * level;
    }

    /**
     * 조각 고정 한 번의 점수 증가분.
     * 하드드롭은 지운 줄이 없어도 보너스를 받는다.
     */
    public int placementScore(int lines, int level, boolean hardDrop) {
        int delta = lineClearScore(lines, level);
        if (hardDrop) {
            delta += config.hardDropBonus();
        }
        return delta;
    }
}
