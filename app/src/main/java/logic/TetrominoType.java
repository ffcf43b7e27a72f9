package logic;

/**
 * 일곱 가지 테트로미노 종류와 기본(스폰) 모양.
 * 색상은 렌더러 전달용일 뿐 로직에서는 사용하지 않는다.
 */
public enum TetrominoType {
    I("#00f0f0", new int[][] {
            { 1, 1, 1, 1 }
    }),
    O("#f0f000", new int[][] {
            { 1, 1 },
            { 1, 1 }
    }),
    T("#a000f0", new int[][] {
            { 0, 1, 0 },
            { 1, 1, 1 }
    }),
    S("#00f000", new int[][] {
            { 0, 1, 1 },
            { 1, 1, 0 }
    }),
    Z("#f00000", new int[][] {
            { 1, 1, 0 },
            { 0, 1, 1 }
    }),
    J("#0000f0", new int[][] {
            { 1, 0, 0 },
            { 1, 1, 1 }
    }),
    L("#f0a000", new int[][] {
            { 0, 0, 1 },
            { 1, 1, 1 }
    });

    private final String color;
    private final int[][] spawnShape;

    TetrominoType(String color, int[][] spawnShape) {
        this.color = color;
        this.spawnShape = spawnShape;
    }

    public String color() { return color; }

    /** 스폰 방향 모양의 복사본 */
    public int[][] spawnShape() {
        int[][] copy = new int[spawnShape.length][];
        for (int i = 0; i < spawnShape.length; i++) {
            copy[i] = spawnShape[i].clone();
        }
        return copy;
    }
}
