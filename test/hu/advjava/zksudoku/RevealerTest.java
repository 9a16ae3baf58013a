package hu.advjava.zksudoku;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.LongStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class RevealerTest {
    private final Revealer revealer = new Revealer();
    private Permutation permutation;
    private Commitment commitment;

    @BeforeEach
    public void setUp() {
        permutation = new Permuter().permute(ExampleSudoku.ZK_1.solutionGrid());
        commitment = new Committer().commit(permutation);
    }

    @Test
    public void opensRowZero() {
        var row0 = new Request.IndexSequence("row 0", IntStream.range(0, 9).toArray());
        var response = (Response.ValuesReveal) revealer.reveal(permutation, commitment, row0);

        assertAll(
            () -> assertArrayEquals(Arrays.copyOfRange(permutation.grid(), 0, 9), response.values()),
            () -> assertArrayEquals(Arrays.copyOfRange(commitment.gridNonces(), 0, 9), response.nonces()),
            () -> assertTrue(new Verifier().verify(row0, response, commitment))
        );
    }

    @Test
    public void keepsUnopenedNoncesSecret() {
        for (Request request : ChallengeCatalogue.standard().requests()) {
            Response response = revealer.reveal(permutation, commitment, request);
            Set<Long> disclosed = response instanceof Response.ValuesReveal v
                    ? LongStream.of(v.nonces()).boxed().collect(Collectors.toSet())
                    : Set.of(((Response.MappingReveal) response).nonce());
            Set<Integer> opened = request instanceof Request.IndexSequence seq
                    ? IntStream.of(seq.indices()).boxed().collect(Collectors.toSet())
                    : Set.of();

            long[] nonces = commitment.gridNonces();
            IntStream.range(0, Grids.CELLS)
                    .filter(i -> !opened.contains(i))
                    .forEach(i -> assertFalse(disclosed.contains(nonces[i]), request.label() + " leaks cell " + i));
            if (request.kind() == Request.Kind.VALUES) {
                assertFalse(disclosed.contains(commitment.mappingNonce()), request.label() + " leaks the mapping nonce");
            }
        }
    }

    @Test
    public void opensMapping() {
        var response = (Response.MappingReveal) revealer.reveal(permutation, commitment, Request.RevealMapping.INSTANCE);
        assertArrayEquals(permutation.mapping(), response.mapping());
        assertEquals(commitment.mappingNonce(), response.nonce());
    }

    @Test
    public void rejectsIndexOutsideGrid() {
        var bad = new Request.IndexSequence("bad", new int[] {81});
        assertThrows(IndexOutOfBoundsException.class, () -> revealer.reveal(permutation, commitment, bad));
    }
}
