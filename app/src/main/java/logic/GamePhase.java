package logic;

public enum GamePhase {
    IDLE,
    PLAYING,
    PAUSED,
    GAME_OVER
}
