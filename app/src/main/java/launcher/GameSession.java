package launcher;

import component.GameController;
import component.GameLoop;
import component.score.HighScoreHook;
import logic.BoardLogic;

/** 한 플레이 화면 묶음: 엔진 + 타이머 + 입력 */
public class GameSession implements AutoCloseable {
    private final BoardLogic logic;
    private final GameLoop loop;
    private final GameController controller;
    private final HighScoreHook highScoreHook;   // 하이스코어 없는 변형은 null

    GameSession(BoardLogic logic, GameLoop loop, GameController controller, HighScoreHook highScoreHook) {
        this.logic = logic;
        this.loop = loop;
        this.controller = controller;
        this.highScoreHook = highScoreHook;
    }

    public BoardLogic logic() { return logic; }
    public GameLoop loop() { return loop; }
    public GameController controller() { return controller; }

    /** "start new game" */
    public void start() {
        loop.start();
        logic.start();
    }

    /** 화면 종료: 타이머 정리, 남은 하이스코어 저장 마무리 후 세션 폐기 */
    @Override
    public void close() {
        loop.shutdown();
        if (highScoreHook != null) {
            logic.removeListener(highScoreHook);
            highScoreHook.close();
        }
        logic.reset();
    }
}
