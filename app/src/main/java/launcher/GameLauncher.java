package launcher;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import component.GameConfig;
import component.GameController;
import component.GameLoop;
import component.config.Settings;
import component.score.HighScoreHook;
import component.score.NamePrompt;
import component.score.ScoreBoard;
import component.score.ScoreEntry;
import logic.BoardLogic;
import logic.GameListener;
import logic.RandomSource;

/**
 * 두 게임 변형을 같은 엔진으로 조립한다.
 * main 은 화면 없이 돌아가는 데모 (무작위 입력, 게임 오버까지).
 */
public class GameLauncher {

    private GameLauncher() {}

    public static GameSession createTetris(Settings settings, Runnable repaint) {
        return create(GameConfig.tetris(), settings, RandomSource.system(), null, null, repaint);
    }

    public static GameSession createLineDestroyer(Settings settings, ScoreBoard scoreBoard,
                                                  NamePrompt prompt, Runnable repaint) {
        return create(GameConfig.lineDestroyer(), settings, RandomSource.system(), scoreBoard, prompt, repaint);
    }

    public static GameSession create(GameConfig config, Settings settings, RandomSource random,
                                     ScoreBoard scoreBoard, NamePrompt prompt, Runnable repaint) {
        BoardLogic logic = new BoardLogic(config, random);

        HighScoreHook hook = null;
        if (config.highScoresEnabled()) {
            if (scoreBoard == null || prompt == null) {
                throw new IllegalArgumentException(config.gameId() + " needs a score board and a name prompt");
            }
            // 이름 입력은 전용 스레드에서: 엔진은 계속 조회 가능
            hook = new HighScoreHook(scoreBoard, config.gameId(), prompt);
            logic.addListener(hook);
        }

        GameLoop loop = new GameLoop(logic, repaint);
        GameController controller = new GameController(logic, settings.keymap, repaint);
        return new GameSession(logic, loop, controller, hook);
    }

    // ============================================
    // 데모
    // ============================================
    private static final String[] DEMO_KEYS = { "LEFT", "RIGHT", "UP", "DOWN", "SPACE" };

    public static void main(String[] args) throws InterruptedException {
        String variant = args.length > 0 ? args[0] : "tetris";
        Settings settings = Settings.load(Path.of("settings.json"));

        GameConfig base = "lineDestroyer".equals(variant) ? GameConfig.lineDestroyer() : GameConfig.tetris();
        // 데모는 빠르게
        GameConfig config = base.toBuilder().dropInterval(60, 5, 20).build();

        ScoreBoard scoreBoard = ScoreBoard.atPath(Path.of(settings.scoreFile));
        NamePrompt prompt = score -> "demo";

        CountDownLatch over = new CountDownLatch(1);
        try (GameSession session = create(config, settings, RandomSource.system(), scoreBoard, prompt, null)) {
            session.logic().addListener(new GameListener() {
                @Override
                public void onGameOver(int finalScore) {
                    over.countDown();
                }
            });
            session.start();

            GameController controller = session.controller();
            while (!over.await(40, TimeUnit.MILLISECONDS)) {
                controller.handleKey(DEMO_KEYS[ThreadLocalRandom.current().nextInt(DEMO_KEYS.length)]);
            }

            BoardLogic logic = session.logic();
            System.out.println("[Demo] " + config.gameId() + " finished: score=" + logic.getScore()
                    + ", lines=" + logic.getLinesCleared() + ", level=" + logic.getLevel());
        }

        if (config.highScoresEnabled()) {
            List<ScoreEntry> top = scoreBoard.getHighScores(config.gameId(), ScoreBoard.MAX_ENTRIES);
            for (int i = 0; i < top.size(); i++) {
                System.out.println("  " + (i + 1) + ". " + top.get(i).name() + " " + top.get(i).score());
            }
        }
    }
}
