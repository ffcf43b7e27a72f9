package component.score;

import java.util.Objects;

/** 점수 기록 한 건 */
public final class ScoreEntry {
    private String name;
    private int score;
    private String gameId;
    private long createdAt;

    // Gson
    private ScoreEntry() {}

    public ScoreEntry(String name, int score, String gameId, long createdAt) {
        this.name = name;
        this.score = score;
        this.gameId = gameId;
        this.createdAt = createdAt;
    }

    public String name() { return name; }
    public int score() { return score; }
    public String gameId() { return gameId; }
    public long createdAt() { return createdAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScoreEntry e)) return false;
        return score == e.score && createdAt == e.createdAt
                && Objects.equals(name, e.name) && Objects.equals(gameId, e.gameId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, score, gameId, createdAt);
    }

    @Override
    public String toString() {
        return "ScoreEntry{" + name + ", " + score + ", " + gameId + "}";
    }
}
