package logic;

import java.util.Objects;

/**
 * MovementService
 * -----------------------
 * - 이동/회전/스폰/드롭 판정의 유일한 기준 (isValidMove)
 * - 조각 고정 (placePiece), 하드드롭 착지 위치 계산
 * - 모든 연산은 부수효과 없음: 입력 Grid는 건드리지 않는다
 */
public class MovementService {

    private final CollisionOverride override;

    public MovementService() {
        this(CollisionOverride.NONE);
    }

    public MovementService(CollisionOverride override) {
        this.override = Objects.requireNonNull(override, "override");
    }

    /**
     * candidate 위치에 조각을 둘 수 있는지.
     * 좌우 벽, 바닥을 벗어나면 false. 보드 위쪽(y &lt; 0) 칸은 점유 검사에서 제외한다.
     */
    public boolean isValidMove(Grid grid, GamePiece piece, Position candidate) {
        if (override.forceCollision(grid, piece, candidate)) {
            return false;
        }

        Tetromino t = piece.tetromino();
        for (int y = 0; y < t.height(); y++) {
            for (int x = 0; x < t.width(); x++) {
                if (!t.isFilled(x, y)) continue;

                int bx = candidate.x() + x;
                int by = candidate.y() + y;

                if (bx < 0 || bx >= grid.width() || by >= grid.height()) {
                    return false;
                }
                if (by >= 0 && grid.isOccupied(bx, by)) {
                    return false;
                }
            }
        }
        return true;
    }

    /** 현재 위치 기준 (dx, dy) 이동 가능 여부 */
    public boolean canMove(Grid grid, GamePiece piece, int dx, int dy) {
        return isValidMove(grid, piece, piece.position().translate(dx, dy));
    }

    /** 조각 칸들을 1로 채운 새 Grid. 보드 위로 삐져나온 칸은 버린다. */
    public Grid placePiece(Grid grid, GamePiece piece) {
        int[][] cells = grid.toArray();
        Tetromino t = piece.tetromino();
        Position p = piece.position();

        for (int y = 0; y < t.height(); y++) {
            for (int x = 0; x < t.width(); x++) {
                if (!t.isFilled(x, y)) continue;

                int bx = p.x() + x;
                int by = p.y() + y;
                if (by < 0) continue;
                if (bx >= 0 && bx < grid.width() && by < grid.height()) {
                    cells[by][bx] = Grid.FILLED;
                }
            }
        }
        return Grid.of(cells);
    }

    /** y+1 이 막힐 때까지 내려간 착지 위치 (하드드롭용) */
    public Position calculateDropPosition(Grid grid, GamePiece piece) {
        Position pos = piece.position();
        while (isValidMove(grid, piece, pos.translate(0, 1))) {
            pos = pos.translate(0, 1);
        }
        return pos;
    }
}
