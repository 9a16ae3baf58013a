package hu.advjava.zksudoku;

import java.util.Arrays;

/** The prover's opening for a {@link Request}, tagged with the same {@link Request.Kind}. */
public sealed interface Response permits Response.MappingReveal, Response.ValuesReveal {

    Request.Kind kind();

    record MappingReveal(int[] mapping, long nonce) implements Response {
        public MappingReveal {
            mapping = mapping.clone();
        }

        @Override
        public int[] mapping() {
            return mapping.clone();
        }

        @Override
        public Request.Kind kind() {
            return Request.Kind.MAPPING;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof MappingReveal other && nonce == other.nonce && Arrays.equals(mapping, other.mapping);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(mapping) + Long.hashCode(nonce);
        }

        @Override
        public String toString() {
            return "MappingReveal[mapping=" + Arrays.toString(mapping) + ", nonce=" + nonce + "]";
        }
    }

    record ValuesReveal(int[] values, long[] nonces) implements Response {
        public ValuesReveal {
            values = values.clone();
            nonces = nonces.clone();
        }

        @Override
        public int[] values() {
            return values.clone();
        }

        @Override
        public long[] nonces() {
            return nonces.clone();
        }

        @Override
        public Request.Kind kind() {
            return Request.Kind.VALUES;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ValuesReveal other
                    && Arrays.equals(values, other.values) && Arrays.equals(nonces, other.nonces);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(values) + Arrays.hashCode(nonces);
        }

        @Override
        public String toString() {
            return "ValuesReveal[values=" + Arrays.toString(values) + ", nonces=" + Arrays.toString(nonces) + "]";
        }
    }
}
