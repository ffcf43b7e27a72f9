package logic;

import java.util.Objects;

/**
 * 다음 조각 생성기.
 * 미리보기용 next 를 항상 한 개 앞서 만들어 둔다.
 */
public class PieceGenerator {

    private static final TetrominoType[] TYPES = TetrominoType.values();

    private final RandomSource random;
    private Tetromino next;

    public PieceGenerator(RandomSource random) {
        this.random = Objects.requireNonNull(random, "random");
        this.next = randomTetromino();
    }

    /** 일곱 종류 중 균등 선택 */
    public Tetromino randomTetromino() {
        return Tetromino.of(TYPES[random.nextInt(TYPES.length)]);
    }

    public Tetromino peekNext() {
        return next;
    }

    /** 미리보기 조각을 꺼내고 즉시 새 미리보기를 뽑는다 */
    public Tetromino take() {
        Tetromino taken = next;
        next = randomTetromino();
        return taken;
    }

    /** 새 세션용: 미리보기 다시 뽑기 */
    public void reset() {
        next = randomTetromino();
    }

    public static Position spawnPosition(int boardWidth) {
        return new Position(boardWidth / 2 - 1, 0);
    }
}
