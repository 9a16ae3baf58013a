package hu.advjava.zksudoku;

import java.util.Arrays;

/** What the verifier sees of a commitment: the hashes, never the nonces. */
public record PublicCommitment(String[] gridHashes, String mappingHash) {
    public PublicCommitment {
        if (gridHashes.length != Grids.CELLS)
            throw new IllegalArgumentException("Commitment must cover " + Grids.CELLS + " cells");
        gridHashes = gridHashes.clone();
    }

    @Override
    public String[] gridHashes() {
        return gridHashes.clone();
    }

    public String gridHashAt(int index) {
        return gridHashes[index];
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PublicCommitment other
                && Arrays.equals(gridHashes, other.gridHashes)
                && mappingHash.equals(other.mappingHash);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(gridHashes) + mappingHash.hashCode();
    }

    @Override
    public String toString() {
        return "PublicCommitment[mappingHash=" + mappingHash + "]";
    }
}
