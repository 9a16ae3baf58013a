package hu.advjava.zksudoku;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

public class ExampleSudokuTest {
    @Test
    public void checkCondition() {
        Arrays.stream(ExampleSudoku.values()).forEach(exampleSudoku -> {
            int[] puzzle = exampleSudoku.puzzleGrid(), solution = exampleSudoku.solutionGrid();

            assertAll(
                // the solution keeps every given of the puzzle
                () -> IntStream.range(0, Grids.CELLS)
                        .filter(i -> puzzle[i] != 0)
                        .forEach(i -> assertEquals(puzzle[i], solution[i], "cell " + i)),
                // every row, column and box holds 1..9
                () -> ChallengeCatalogue.standard().requests().stream()
                        .filter(Request.IndexSequence.class::isInstance)
                        .map(Request.IndexSequence.class::cast)
                        .forEach(seq -> assertTrue(
                                Verifier.hasNumbers1To9(IntStream.of(seq.indices()).map(i -> solution[i]).toArray()),
                                seq.label()))
            );
        });
    }

    @Test
    public void boardsAreCopies() {
        int[][] board = ExampleSudoku.ZK_1.getBoard();
        board[0][0] = 0;
        assertEquals(7, ExampleSudoku.ZK_1.getBoard()[0][0]);
        assertEquals(ExampleSudoku.ZK_1, ExampleSudoku.findByName("zk_1").orElseThrow());
        assertTrue(ExampleSudoku.findByName("nope").isEmpty());
    }

    @Test
    public void gridShapes() {
        int[] grid = ExampleSudoku.ZK_1.solutionGrid();
        assertTrue(Arrays.deepEquals(ExampleSudoku.ZK_1.getSolution(), Grids.toBoard(grid)));
        assertThrows(IllegalArgumentException.class, () -> Grids.requireSolved(new int[80]));
        assertThrows(IllegalArgumentException.class, () -> Grids.requireSolved(ExampleSudoku.ZK_1.puzzleGrid()));
        assertThrows(IllegalArgumentException.class, () -> Grids.flatten(new int[9][8]));
    }
}
