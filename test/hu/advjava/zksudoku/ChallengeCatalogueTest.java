package hu.advjava.zksudoku;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

public class ChallengeCatalogueTest {
    private final ChallengeCatalogue catalogue = ChallengeCatalogue.standard();

    @Test
    public void holdsRowsColumnsBoxesAndMapping() {
        assertAll(
            () -> assertEquals(28, catalogue.size()),
            () -> assertEquals(28, new HashSet<>(catalogue.requests()).size()),
            () -> assertEquals(Request.RevealMapping.INSTANCE, catalogue.get(27)),
            () -> assertArrayEquals(new int[] {0, 1, 2, 3, 4, 5, 6, 7, 8}, ((Request.IndexSequence) catalogue.get(0)).indices()),
            () -> assertArrayEquals(new int[] {0, 9, 18, 27, 36, 45, 54, 63, 72}, ((Request.IndexSequence) catalogue.get(9)).indices()),
            () -> assertArrayEquals(new int[] {0, 1, 2, 9, 10, 11, 18, 19, 20}, ((Request.IndexSequence) catalogue.get(18)).indices()),
            () -> assertArrayEquals(new int[] {60, 61, 62, 69, 70, 71, 78, 79, 80}, ((Request.IndexSequence) catalogue.get(26)).indices()),
            () -> assertEquals("box 8", catalogue.get(26).label())
        );
    }

    @Test
    public void everyCellIsInExactlyOneRowColumnAndBox() {
        Map<Integer, Long> hits = catalogue.requests().stream()
                .filter(Request.IndexSequence.class::isInstance)
                .flatMapToInt(r -> IntStream.of(((Request.IndexSequence) r).indices()))
                .boxed()
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));

        assertEquals(Grids.CELLS, hits.size());
        assertTrue(hits.values().stream().allMatch(n -> n == 3));
    }

    @Test
    public void isImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> catalogue.requests().remove(0));
        assertThrows(IllegalArgumentException.class, () -> new Request.IndexSequence("empty", new int[0]));
    }

    @Test
    public void challengerCoversWholeCatalogue() {
        var challenger = new Challenger(new Random(3));
        var seen = new HashSet<Request>();
        IntStream.range(0, 2000).forEach(i -> seen.add(challenger.nextChallenge(catalogue)));
        assertEquals(28, seen.size());
    }
}
