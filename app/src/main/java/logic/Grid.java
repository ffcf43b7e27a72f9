package logic;

import java.util.Arrays;

/**
 * Grid
 * -----------------------
 * - 고정 크기 점유 행렬 (0 = 빈칸, 1 = 고정된 블록)
 * - 불변 스냅샷: 변경 연산은 항상 새 Grid를 돌려준다
 * - 크기는 생성 이후 절대 바뀌지 않는다
 */
public final class Grid {
    public static final int WIDTH = 10;
    public static final int HEIGHT = 20;

    public static final int EMPTY = 0;
    public static final int FILLED = 1;

    private final int[][] cells;
    private final int width;
    private final int height;

    private Grid(int[][] cells, int width, int height) {
        this.cells = cells;
        this.width = width;
        this.height = height;
    }

    public static Grid createEmpty() {
        return createEmpty(WIDTH, HEIGHT);
    }

    public static Grid createEmpty(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("grid size must be positive: " + width + "x" + height);
        }
        return new Grid(new int[height][width], width, height);
    }

    /** 직접 구성한 행렬로 Grid 생성 (복사본 보관) */
    public static Grid of(int[][] rows) {
        if (rows == null || rows.length == 0 || rows[0].length == 0) {
            throw new IllegalArgumentException("rows must not be empty");
        }
        int w = rows[0].length;
        int[][] copy = new int[rows.length][];
        for (int y = 0; y < rows.length; y++) {
            if (rows[y].length != w) {
                throw new IllegalArgumentException("row " + y + " has width " + rows[y].length + ", expected " + w);
            }
            copy[y] = rows[y].clone();
        }
        return new Grid(copy, w, rows.length);
    }

    public int width() { return width; }
    public int height() { return height; }

    public int get(int x, int y) {
        return cells[y][x];
    }

    public boolean isOccupied(int x, int y) {
        return cells[y][x] != EMPTY;
    }

    /** 모든 칸이 1 이면 완성된 줄 */
    public boolean isRowFull(int y) {
        for (int c : cells[y]) {
            if (c != FILLED) return false;
        }
        return true;
    }

    public boolean isRowEmpty(int y) {
        for (int c : cells[y]) {
            if (c != EMPTY) return false;
        }
        return true;
    }

    public int[][] toArray() {
        int[][] copy = new int[height][];
        for (int y = 0; y < height; y++) {
            copy[y] = cells[y].clone();
        }
        return copy;
    }

    /** 한 칸만 바꾼 새 Grid */
    public Grid with(int x, int y, int value) {
        int[][] copy = toArray();
        copy[y][x] = value;
        return new Grid(copy, width, height);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid other)) return false;
        return Arrays.deepEquals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int[] r : cells) {
            for (int c : r) {
                sb.append(c == EMPTY ? '.' : c == FILLED ? '#' : '@');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
