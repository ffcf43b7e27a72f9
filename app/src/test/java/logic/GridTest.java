package logic;

import org.junit.Test;

import static org.junit.Assert.*;

public class GridTest {

    @Test
    public void testCreateEmpty() {
        Grid g = Grid.createEmpty();
        assertEquals(Grid.WIDTH, g.width());
        assertEquals(Grid.HEIGHT, g.height());
        for (int y = 0; y < g.height(); y++) {
            assertTrue(g.isRowEmpty(y));
        }
    }

    @Test
    public void testWithReturnsNewGrid() {
        Grid g = Grid.createEmpty();
        Grid changed = g.with(3, 5, Grid.FILLED);

        assertNotSame(g, changed);
        assertEquals(0, g.get(3, 5));
        assertEquals(1, changed.get(3, 5));
    }

    @Test
    public void testOfCopiesInput() {
        int[][] rows = new int[Grid.HEIGHT][Grid.WIDTH];
        Grid g = Grid.of(rows);
        rows[0][0] = 1;
        assertEquals(0, g.get(0, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOfRejectsRaggedRows() {
        Grid.of(new int[][] { { 0, 0 }, { 0 } });
    }

    @Test
    public void testRowFull() {
        Grid g = TestSources.rowsWithGap(19, 19, -1, -1);
        assertTrue(g.isRowFull(19));
        assertFalse(g.isRowFull(18));
    }
}
