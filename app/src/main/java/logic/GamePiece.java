package logic;

import java.util.Objects;

/** 현재 떨어지는 조각: Tetromino + 위치 */
public final class GamePiece {

    private final Tetromino tetromino;
    private final Position position;

    public GamePiece(Tetromino tetromino, Position position) {
        this.tetromino = Objects.requireNonNull(tetromino, "tetromino");
        this.position = Objects.requireNonNull(position, "position");
    }

    public Tetromino tetromino() { return tetromino; }
    public Position position() { return position; }

    public GamePiece moveTo(Position newPosition) {
        return new GamePiece(tetromino, newPosition);
    }

    public GamePiece withTetromino(Tetromino newTetromino) {
        return new GamePiece(newTetromino, position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GamePiece other)) return false;
        return tetromino.equals(other.tetromino) && position.equals(other.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tetromino, position);
    }

    @Override
    public String toString() {
        return "GamePiece{" + tetromino.type() + " @ " + position + "}";
    }
}
