package hu.advjava.zksudoku;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed puzzle both parties know, and the solution only the prover knows.
 */
public enum ExampleSudoku {
    ZK_1(new int[][] {
            {7, 4, 0, 3, 0, 5, 2, 1, 0},
            {0, 0, 0, 7, 0, 0, 5, 6, 0},
            {0, 0, 0, 0, 8, 1, 0, 7, 0},
            {0, 1, 0, 0, 2, 8, 0, 0, 7},
            {2, 0, 0, 0, 4, 0, 0, 0, 6},
            {9, 0, 0, 6, 3, 0, 0, 5, 0},
            {0, 6, 0, 8, 5, 0, 0, 0, 0},
            {0, 3, 1, 0, 0, 2, 0, 0, 0},
            {0, 7, 2, 9, 0, 6, 0, 8, 3},
        }, new int[][] {
            {7, 4, 8, 3, 6, 5, 2, 1, 9},
            {1, 2, 3, 7, 9, 4, 5, 6, 8},
            {6, 9, 5, 2, 8, 1, 3, 7, 4},
            {3, 1, 6, 5, 2, 8, 9, 4, 7},
            {2, 5, 7, 1, 4, 9, 8, 3, 6},
            {9, 8, 4, 6, 3, 7, 1, 5, 2},
            {4, 6, 9, 8, 5, 3, 7, 2, 1},
            {8, 3, 1, 4, 7, 2, 6, 9, 5},
            {5, 7, 2, 9, 1, 6, 4, 8, 3},
        });

    private final int[][] board;
    private final int[][] solution;

    private ExampleSudoku(int[][] board, int[][] solution) {
        this.board = board;
        this.solution = solution;
    }

    public int[][] getBoard() {
        return Grids.deepCopy(board);
    }

    public int[][] getSolution() {
        return Grids.deepCopy(solution);
    }

    /** Row-major puzzle cells, 0 = blank. */
    public int[] puzzleGrid() {
        return Grids.flatten(board);
    }

    public int[] solutionGrid() {
        return Grids.flatten(solution);
    }

    public static Optional<ExampleSudoku> findByName(String name) {
        return Arrays.stream(values()).filter(e -> e.name().equalsIgnoreCase(name)).findAny();
    }
}
