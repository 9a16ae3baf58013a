package hu.advjava.zksudoku;

import java.security.SecureRandom;
import java.util.Random;
import java.util.stream.IntStream;

/** Commits to every cell of a permuted grid and to its mapping, each under a fresh nonce. */
public final class Committer {
    /** Nonces are drawn from [0, 2^62). */
    public static final long NONCE_BOUND = 1L << 62;

    private final Random random;

    public Committer() {
        this(new SecureRandom());
    }

    public Committer(Random random) {
        this.random = random;
    }

    public Commitment commit(Permutation permutation) {
        int[] grid = permutation.grid();
        long[] gridNonces = IntStream.range(0, grid.length).mapToLong(i -> nextNonce()).toArray();
        String[] gridHashes = IntStream.range(0, grid.length)
                .mapToObj(i -> CommitmentHash.hash(grid[i], gridNonces[i]))
                .toArray(String[]::new);

        long mappingNonce = nextNonce();
        String mappingHash = CommitmentHash.hash(permutation.mapping(), mappingNonce);

        return new Commitment(gridHashes, gridNonces, mappingHash, mappingNonce);
    }

    private long nextNonce() {
        return random.nextLong(NONCE_BOUND);
    }
}
