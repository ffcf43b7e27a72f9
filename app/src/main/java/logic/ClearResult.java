package logic;

import java.util.List;

/** clearLines 결과: 압축된 Grid + 지운 줄 수 + 지운 줄 인덱스(원래 Grid 기준) */
public final class ClearResult {

    private final Grid grid;
    private final List<Integer> clearedRows;

    ClearResult(Grid grid, List<Integer> clearedRows) {
        this.grid = grid;
        this.clearedRows = List.copyOf(clearedRows);
    }

    public Grid grid() { return grid; }
    public int linesCleared() { return clearedRows.size(); }
    public List<Integer> clearedRows() { return clearedRows; }

    @Override
    public String toString() {
        return "ClearResult{lines=" + linesCleared() + ", rows=" + clearedRows + "}";
    }
}
