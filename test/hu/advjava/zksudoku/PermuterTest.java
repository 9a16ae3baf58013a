package hu.advjava.zksudoku;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

public class PermuterTest {
    private final int[] solution = ExampleSudoku.ZK_1.solutionGrid();

    @Test
    public void mappingIsBijectionAndAppliedToEveryCell() {
        var permuter = new Permuter(new Random(7));
        for (int n = 0; n < 500; n++) {
            Permutation p = permuter.permute(solution);
            int[] mapping = p.mapping(), grid = p.grid();

            assertTrue(Verifier.hasNumbers1To9(mapping));
            assertEquals(Grids.CELLS, grid.length);
            IntStream.range(0, Grids.CELLS).forEach(i -> assertEquals(mapping[solution[i] - 1], grid[i]));
        }
    }

    @Test
    public void mappingsVary() {
        var permuter = new Permuter();
        Set<List<Integer>> seen = new HashSet<>();
        for (int n = 0; n < 50; n++) {
            seen.add(IntStream.of(permuter.permute(solution).mapping()).boxed().toList());
        }
        // 9! mappings: 50 draws repeating down to a handful would mean a broken shuffle
        assertTrue(seen.size() > 40, "distinct mappings: " + seen.size());
    }

    @Test
    public void permutationIsImmutable() {
        Permutation p = new Permuter().permute(solution);
        int before = p.grid()[0];
        p.grid()[0] = 0;
        p.mapping()[0] = 0;
        assertEquals(before, p.grid()[0]);
        assertTrue(Verifier.hasNumbers1To9(p.mapping()));
    }

    @Test
    public void rejectsMalformedSolution() {
        var permuter = new Permuter();
        assertAll(
            () -> assertThrows(IllegalArgumentException.class, () -> permuter.permute(new int[9])),
            () -> assertThrows(IllegalArgumentException.class, () -> permuter.permute(ExampleSudoku.ZK_1.puzzleGrid())),
            () -> assertThrows(IllegalArgumentException.class, () -> permuter.permute(null))
        );
    }
}
