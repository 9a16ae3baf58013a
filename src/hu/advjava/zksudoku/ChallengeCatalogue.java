package hu.advjava.zksudoku;

import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * The 28 challenges a verifier may issue: 9 rows, 9 columns, 9 boxes and the mapping.
 * Built from the board geometry alone.
 */
public final class ChallengeCatalogue {
    private final List<Request> requests;

    private ChallengeCatalogue(List<Request> requests) {
        this.requests = List.copyOf(requests);
    }

    public static ChallengeCatalogue standard() {
        Stream<Request> rows = IntStream.range(0, Grids.SIZE).mapToObj(r -> new Request.IndexSequence(
                "row " + r, IntStream.range(0, Grids.SIZE).map(c -> r * Grids.SIZE + c).toArray()));
        Stream<Request> columns = IntStream.range(0, Grids.SIZE).mapToObj(c -> new Request.IndexSequence(
                "column " + c, IntStream.range(0, Grids.SIZE).map(r -> r * Grids.SIZE + c).toArray()));
        Stream<Request> boxes = IntStream.range(0, Grids.SIZE).mapToObj(b -> new Request.IndexSequence(
                "box " + b, boxIndices(b)));

        return new ChallengeCatalogue(Stream.of(rows, columns, boxes, Stream.<Request>of(Request.RevealMapping.INSTANCE))
                .flatMap(s -> s)
                .toList());
    }

    // box b starts at row 3*(b/3), column 3*(b%3)
    private static int[] boxIndices(int box) {
        int minRow = (box / Grids.BOX) * Grids.BOX, minCol = (box % Grids.BOX) * Grids.BOX;
        return IntStream.range(0, Grids.SIZE)
                .map(k -> (minRow + k / Grids.BOX) * Grids.SIZE + minCol + k % Grids.BOX)
                .toArray();
    }

    public List<Request> requests() {
        return requests;
    }

    public int size() {
        return requests.size();
    }

    public Request get(int index) {
        return requests.get(index);
    }
}
