package hu.advjava.zksudoku;

/**
 * The prover's side of a commitment: every hash together with the nonce that opens it.
 * Only {@link #publicPart()} is ever handed to the verifier.
 */
public record Commitment(String[] gridHashes, long[] gridNonces, String mappingHash, long mappingNonce) {
    public Commitment {
        if (gridHashes.length != Grids.CELLS || gridNonces.length != Grids.CELLS)
            throw new IllegalArgumentException("Commitment must cover " + Grids.CELLS + " cells");
        gridHashes = gridHashes.clone();
        gridNonces = gridNonces.clone();
    }

    @Override
    public String[] gridHashes() {
        return gridHashes.clone();
    }

    @Override
    public long[] gridNonces() {
        return gridNonces.clone();
    }

    long gridNonceAt(int index) {
        return gridNonces[index];
    }

    public PublicCommitment publicPart() {
        return new PublicCommitment(gridHashes, mappingHash);
    }

    @Override
    public String toString() {
        return "Commitment[mappingHash=" + mappingHash + "]";
    }
}
