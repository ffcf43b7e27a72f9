package logic;

/**
 * 엔진 이벤트 구독자 (렌더러, 하이스코어 저장, 사운드 등).
 * 필요한 메서드만 오버라이드하면 된다.
 */
public interface GameListener {

    /** start() 재시작이면 from == to == PLAYING 일 수 있다 */
    default void onPhaseChanged(GamePhase from, GamePhase to) {}

    default void onPiecePlaced(GamePiece piece, boolean hardDrop) {}

    default void onLinesCleared(int lines, int totalLines, int scoreDelta) {}

    default void onLevelUp(int level, int dropIntervalMs) {}

    /** GAME_OVER 전이가 끝난 뒤 호출된다 */
    default void onGameOver(int finalScore) {}

    /** 명령/틱으로 상태가 바뀔 때마다 */
    default void onStateChanged(SessionState state) {}
}
