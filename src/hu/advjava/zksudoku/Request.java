package hu.advjava.zksudoku;

import java.util.Arrays;

/**
 * A verifier challenge: open a row, column or box of the permuted grid, or open the mapping.
 */
public sealed interface Request permits Request.IndexSequence, Request.RevealMapping {

    enum Kind { VALUES, MAPPING }

    Kind kind();

    String label();

    record IndexSequence(String label, int[] indices) implements Request {
        public IndexSequence {
            if (indices.length == 0)
                throw new IllegalArgumentException("Index sequence must not be empty");
            indices = indices.clone();
        }

        @Override
        public int[] indices() {
            return indices.clone();
        }

        @Override
        public Kind kind() {
            return Kind.VALUES;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof IndexSequence other
                    && label.equals(other.label) && Arrays.equals(indices, other.indices);
        }

        @Override
        public int hashCode() {
            return 31 * label.hashCode() + Arrays.hashCode(indices);
        }

        @Override
        public String toString() {
            return label + " " + Arrays.toString(indices);
        }
    }

    record RevealMapping() implements Request {
        public static final RevealMapping INSTANCE = new RevealMapping();

        @Override
        public Kind kind() {
            return Kind.MAPPING;
        }

        @Override
        public String label() {
            return "mapping";
        }
    }
}
