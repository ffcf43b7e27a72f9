package logic;

/** 보드 위 모양 원점(좌상단) 좌표. 스폰 중에는 y가 음수일 수 있다. */
public final class Position {

    private final int x;
    private final int y;

    public Position(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public int x() { return x; }
    public int y() { return y; }

    public Position translate(int dx, int dy) {
        return new Position(x + dx, y + dy);
    }

    public Position withY(int newY) {
        return new Position(x, newY);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position p)) return false;
        return x == p.x && y == p.y;
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
