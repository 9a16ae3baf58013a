package hu.advjava.zksudoku;

import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Opens exactly the commitments a challenge asks for. The permutation and commitment are
 * trusted to come from the same round.
 */
public final class Revealer {

    public Response reveal(Permutation permutation, Commitment commitment, Request request) {
        if (request instanceof Request.IndexSequence sequence) {
            int[] indices = sequence.indices();
            IntStream.of(indices).forEach(i -> Objects.checkIndex(i, Grids.CELLS));
            return new Response.ValuesReveal(
                    IntStream.of(indices).map(permutation::valueAt).toArray(),
                    IntStream.of(indices).mapToLong(commitment::gridNonceAt).toArray());
        }
        return new Response.MappingReveal(permutation.mapping(), commitment.mappingNonce());
    }
}
