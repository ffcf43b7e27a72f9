package logic;

import org.junit.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.Assert.*;

public class PieceGeneratorTest {

    @Test
    public void testPreviewIsOneStepAhead() {
        PieceGenerator gen = new PieceGenerator(
                TestSources.cycle(TetrominoType.T, TetrominoType.S, TetrominoType.Z));

        assertEquals(TetrominoType.T, gen.peekNext().type());
        assertEquals(TetrominoType.T, gen.take().type());
        // 꺼내자마자 새 미리보기
        assertEquals(TetrominoType.S, gen.peekNext().type());
        assertEquals(TetrominoType.S, gen.take().type());
        assertEquals(TetrominoType.Z, gen.peekNext().type());
    }

    @Test
    public void testAllSevenTypesAppear() {
        PieceGenerator gen = new PieceGenerator(RandomSource.seeded(42));
        Set<TetrominoType> seen = EnumSet.noneOf(TetrominoType.class);
        for (int i = 0; i < 500; i++) {
            seen.add(gen.take().type());
        }
        assertEquals(EnumSet.allOf(TetrominoType.class), seen);
    }

    @Test
    public void testSpawnPosition() {
        assertEquals(new Position(4, 0), PieceGenerator.spawnPosition(10));
        assertEquals(new Position(5, 0), PieceGenerator.spawnPosition(12));
    }

    @Test
    public void testSeededSourcesAreDeterministic() {
        PieceGenerator a = new PieceGenerator(RandomSource.seeded(7));
        PieceGenerator b = new PieceGenerator(RandomSource.seeded(7));
        for (int i = 0; i < 50; i++) {
            assertEquals(a.take(), b.take());
        }
    }
}
