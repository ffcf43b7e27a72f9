package logic;

import java.util.Arrays;
import java.util.Objects;

/**
 * Tetromino
 * -----------------------
 * - 종류(type) + 0/1 모양 행렬 + 표시 색상
 * - 불변 객체: rotated()는 새 인스턴스를 돌려준다
 */
public final class Tetromino {

    private final TetrominoType type;
    private final int[][] shape;
    private final String color;

    public Tetromino(TetrominoType type, int[][] shape, String color) {
        this.type = Objects.requireNonNull(type, "type");
        this.shape = copyOf(Objects.requireNonNull(shape, "shape"));
        this.color = color;
        if (this.shape.length == 0 || this.shape[0].length == 0) {
            throw new IllegalArgumentException("shape must not be empty");
        }
        for (int[] row : this.shape) {
            if (row.length != this.shape[0].length) {
                throw new IllegalArgumentException("shape must be rectangular");
            }
        }
    }

    public static Tetromino of(TetrominoType type) {
        return new Tetromino(type, type.spawnShape(), type.color());
    }

    public TetrominoType type() { return type; }
    public String color() { return color; }

    public int height() { return shape.length; }
    public int width() { return shape[0].length; }

    /** (x, y) 로컬 좌표가 채워져 있는지 */
    public boolean isFilled(int x, int y) {
        return shape[y][x] != 0;
    }

    public int[][] shape() { return copyOf(shape); }

    /**
     * 시계 방향 90도 회전.
     * R×C 모양의 (i, j) 칸은 C×R 결과의 (j, R-1-i) 로 옮겨진다.
     */
    public Tetromino rotated() {
        int rows = shape.length;
        int cols = shape[0].length;
        int[][] rotated = new int[cols][rows];

        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                rotated[j][rows - 1 - i] = shape[i][j];
            }
        }
        return new Tetromino(type, rotated, color);
    }

    private static int[][] copyOf(int[][] src) {
        int[][] copy = new int[src.length][];
        for (int i = 0; i < src.length; i++) {
            copy[i] = src[i].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tetromino other)) return false;
        return type == other.type
                && Objects.equals(color, other.color)
                && Arrays.deepEquals(shape, other.shape);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, color, Arrays.deepHashCode(shape));
    }

    @Override
    public String toString() {
        return "Tetromino{" + type + ", " + width() + "x" + height() + "}";
    }
}
