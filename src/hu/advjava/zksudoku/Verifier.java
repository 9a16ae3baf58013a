package hu.advjava.zksudoku;

import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Checks a prover's opening against its commitment and against the Sudoku rules.
 * Any mismatch rejects the whole round.
 */
public final class Verifier {
    private static final int ALL_DIGITS = 0b1111111110;

    public boolean verify(Request request, Response response, Commitment commitment) {
        return verify(request, response, commitment.publicPart());
    }

    public boolean verify(Request request, Response response, PublicCommitment commitment) {
        if (request.kind() != response.kind()) return false;

        return switch (request.kind()) {
            case MAPPING -> verifyMapping((Response.MappingReveal) response, commitment);
            case VALUES -> verifyValues((Request.IndexSequence) request, (Response.ValuesReveal) response, commitment);
        };
    }

    private boolean verifyMapping(Response.MappingReveal response, PublicCommitment commitment) {
        int[] mapping = response.mapping();
        // what was revealed does not open the mapping commitment
        if (!CommitmentHash.hash(mapping, response.nonce()).equals(commitment.mappingHash())) return false;

        return hasNumbers1To9(mapping);
    }

    private boolean verifyValues(Request.IndexSequence request, Response.ValuesReveal response, PublicCommitment commitment) {
        int[] cells = request.indices();
        IntStream.of(cells).forEach(cell -> Objects.checkIndex(cell, Grids.CELLS));

        int[] values = response.values();
        long[] nonces = response.nonces();
        if (values.length != cells.length || nonces.length != cells.length) return false;

        for (int i = 0; i < cells.length; i++) {
            if (!CommitmentHash.hash(values[i], nonces[i]).equals(commitment.gridHashAt(cells[i]))) return false;
        }

        // the opened cells break the rules of Sudoku
        return hasNumbers1To9(values);
    }

    /** True iff {@code values} holds each of 1..9 exactly once. */
    public static boolean hasNumbers1To9(int[] values) {
        if (values == null || values.length != Grids.SIZE) return false;

        int validation = 0;
        for (int v : values) {
            if (v < 1 || v > Grids.SIZE) return false;
            validation |= 1 << v;
        }
        return validation == ALL_DIGITS;
    }
}
