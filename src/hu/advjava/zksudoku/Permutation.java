package hu.advjava.zksudoku;

import java.util.Arrays;

/**
 * One round's relabelling of the solution.
 *
 * @param mapping {@code mapping[v-1]} is the image of original value {@code v}
 * @param grid    the solution in the new labelling, {@code grid[i] = mapping[solution[i]-1]}
 */
public record Permutation(int[] mapping, int[] grid) {
    public Permutation {
        mapping = mapping.clone();
        grid = grid.clone();
    }

    @Override
    public int[] mapping() {
        return mapping.clone();
    }

    @Override
    public int[] grid() {
        return grid.clone();
    }

    int valueAt(int index) {
        return grid[index];
    }

    @Override
    public String toString() {
        return "Permutation[mapping=" + Arrays.toString(mapping) + "]";
    }
}
