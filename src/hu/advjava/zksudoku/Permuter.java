package hu.advjava.zksudoku;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Relabels the digits of a solution through a uniformly random bijection of 1..9. */
public final class Permuter {
    private final Random random;

    public Permuter() {
        this(new SecureRandom());
    }

    public Permuter(Random random) {
        this.random = random;
    }

    public Permutation permute(int[] solution) {
        Grids.requireSolved(solution);

        List<Integer> digits = IntStream.rangeClosed(1, Grids.SIZE).boxed().collect(Collectors.toList());
        Collections.shuffle(digits, random);
        int[] mapping = digits.stream().mapToInt(Integer::intValue).toArray();

        int[] grid = Arrays.stream(solution).map(v -> mapping[v - 1]).toArray();
        return new Permutation(mapping, grid);
    }
}
