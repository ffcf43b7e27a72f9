package logic;

import java.util.ArrayList;
import java.util.List;

/**
 * ClearService
 * -----------------------
 * - 완성된 줄 찾기 / 제거 / 위쪽 빈 줄 채우기
 * - 남은 줄들의 상대 순서는 유지된다
 */
public class ClearService {

    // ============================================
    // 유틸리티
    // ============================================
    public List<Integer> findFullRows(Grid grid) {
        List<Integer> fullRows = new ArrayList<>();
        for (int y = 0; y < grid.height(); y++) {
            if (grid.isRowFull(y))
                fullRows.add(y);
        }
        return fullRows;
    }

    public int countFullLines(Grid grid) {
        return findFullRows(grid).size();
    }

    // ============================================
    // 줄 제거 + 압축
    // ============================================
    public ClearResult clearLines(Grid grid) {
        List<Integer> fullRows = findFullRows(grid);
        if (fullRows.isEmpty()) {
            return new ClearResult(grid, fullRows);
        }

        int h = grid.height();
        int w = grid.width();
        int[][] src = grid.toArray();
        int[][] dst = new int[h][w];

        // 아래에서 위로 스캔하면서 완성되지 않은 줄만 복사
        int writeRow = h - 1;
        for (int readRow = h - 1; readRow >= 0; readRow--) {
            if (!grid.isRowFull(readRow)) {
                dst[writeRow] = src[readRow];
                writeRow--;
            }
        }
        // writeRow 위쪽은 new int[] 그대로 (빈 줄)

        return new ClearResult(Grid.of(dst), fullRows);
    }
}
