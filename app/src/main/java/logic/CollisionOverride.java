package logic;

/**
 * 충돌 판정 강제용 전략 (테스트에서 결정적인 경로를 만들 때 사용).
 * true를 돌려주면 해당 이동은 무조건 막힌다.
 */
@FunctionalInterface
public interface CollisionOverride {

    CollisionOverride NONE = (grid, piece, candidate) -> false;

    boolean forceCollision(Grid grid, GamePiece piece, Position candidate);
}
