package logic;

import org.junit.Test;

import static org.junit.Assert.*;

public class TetrominoTest {

    @Test
    public void testRotateFourTimesIsIdentity() {
        for (TetrominoType type : TetrominoType.values()) {
            Tetromino t = Tetromino.of(type);
            Tetromino back = t.rotated().rotated().rotated().rotated();
            assertEquals("4회전 후 원래 모양: " + type, t, back);
        }
    }

    @Test
    public void testOPieceRotationOrderOne() {
        Tetromino o = Tetromino.of(TetrominoType.O);
        assertEquals(o, o.rotated());
    }

    @Test
    public void testIPieceChangesDimensions() {
        Tetromino i = Tetromino.of(TetrominoType.I);
        assertEquals(4, i.width());
        assertEquals(1, i.height());

        Tetromino vertical = i.rotated();
        assertEquals(1, vertical.width());
        assertEquals(4, vertical.height());
    }

    @Test
    public void testRotationIsClockwise() {
        // T: [[0,1,0],[1,1,1]] → [[1,0],[1,1],[1,0]]
        Tetromino t = Tetromino.of(TetrominoType.T).rotated();
        assertArrayEquals(new int[][] {
                { 1, 0 },
                { 1, 1 },
                { 1, 0 }
        }, t.shape());
    }

    @Test
    public void testShapeAccessorReturnsCopy() {
        Tetromino t = Tetromino.of(TetrominoType.L);
        int[][] shape = t.shape();
        shape[0][0] = 1;
        assertFalse(t.isFilled(0, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRaggedShapeRejected() {
        new Tetromino(TetrominoType.T, new int[][] { { 1, 1 }, { 1 } }, "#fff");
    }

    @Test
    public void testEveryTypeHasFourCells() {
        for (TetrominoType type : TetrominoType.values()) {
            Tetromino t = Tetromino.of(type);
            int cells = 0;
            for (int y = 0; y < t.height(); y++)
                for (int x = 0; x < t.width(); x++)
                    if (t.isFilled(x, y)) cells++;
            assertEquals(type.name(), 4, cells);
        }
    }
}
