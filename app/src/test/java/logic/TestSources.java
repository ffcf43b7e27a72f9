package logic;

/** 테스트용 고정 난수 공급원 */
final class TestSources {

    private TestSources() {}

    /** 항상 같은 종류만 나오게 */
    static RandomSource always(TetrominoType type) {
        return bound -> type.ordinal();
    }

    /** 주어진 순서대로 반복 */
    static RandomSource cycle(TetrominoType... types) {
        int[] i = { 0 };
        return bound -> types[i[0]++ % types.length].ordinal();
    }

    /** fromRow..toRow 줄을 gapFrom..gapTo 칸만 비우고 채운 grid */
    static Grid rowsWithGap(int fromRow, int toRow, int gapFrom, int gapTo) {
        int[][] cells = new int[Grid.HEIGHT][Grid.WIDTH];
        for (int y = fromRow; y <= toRow; y++) {
            for (int x = 0; x < Grid.WIDTH; x++) {
                cells[y][x] = (x >= gapFrom && x <= gapTo) ? 0 : 1;
            }
        }
        return Grid.of(cells);
    }
}
