package hu.advjava.zksudoku;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Helpers for 9x9 boards in the two shapes the protocol uses:
 * {@code int[][]} boards and flat row-major 81-cell grids.
 */
public final class Grids {
    public static final int SIZE = 9;
    public static final int CELLS = SIZE * SIZE;
    public static final int BOX = 3;

    private Grids() {}

    public static int[] flatten(int[][] board) {
        if (board.length != SIZE || !Arrays.stream(board).allMatch(row -> row.length == SIZE))
            throw new IllegalArgumentException("Board must be 9x9");
        return Arrays.stream(board).flatMapToInt(Arrays::stream).toArray();
    }

    public static int[][] toBoard(int[] grid) {
        requireLength(grid);
        return IntStream.range(0, SIZE)
                .mapToObj(r -> Arrays.copyOfRange(grid, r * SIZE, (r + 1) * SIZE))
                .toArray(int[][]::new);
    }

    /** Defensive deep copy to avoid aliasing */
    public static int[][] deepCopy(int[][] src) {
        return Arrays.stream(src).map(e -> Arrays.copyOf(e, e.length)).toArray(int[][]::new);
    }

    /** Fails fast unless the grid is a completed board: 81 cells, each in 1..9. */
    public static int[] requireSolved(int[] grid) {
        requireLength(grid);
        if (!Arrays.stream(grid).allMatch(v -> v >= 1 && v <= SIZE))
            throw new IllegalArgumentException("Solution cells must be in 1..9");
        return grid;
    }

    private static void requireLength(int[] grid) {
        if (grid == null || grid.length != CELLS)
            throw new IllegalArgumentException("Grid must have exactly " + CELLS + " cells");
    }
}
