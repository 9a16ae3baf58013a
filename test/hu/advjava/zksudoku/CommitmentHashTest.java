package hu.advjava.zksudoku;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class CommitmentHashTest {
    @Test
    public void deterministic() {
        assertEquals(CommitmentHash.hash(5, 1234L), CommitmentHash.hash(5, 1234L));
        assertEquals(CommitmentHash.hash(new int[] {1, 2, 3}, 9L), CommitmentHash.hash(new int[] {1, 2, 3}, 9L));
        assertEquals(64, CommitmentHash.hash(5, 1234L).length());
    }

    @Test
    public void noCollisionsOverSample() {
        Set<String> digests = new HashSet<>();
        int count = 0;
        for (int value = 1; value <= 9; value++) {
            for (long nonce = 0; nonce < 5000; nonce++) {
                digests.add(CommitmentHash.hash(value, nonce));
                count++;
            }
        }
        assertEquals(count, digests.size());
    }

    @Test
    public void encodingIsUnambiguous() {
        assertAll(
            () -> assertNotEquals(CommitmentHash.hash(1, 2L), CommitmentHash.hash(2, 1L)),
            () -> assertNotEquals(CommitmentHash.hash(1, 2L), CommitmentHash.hash(new int[] {1}, 2L)),
            () -> assertNotEquals(CommitmentHash.hash(new int[] {1, 2}, 3L), CommitmentHash.hash(new int[] {12}, 3L)),
            () -> assertNotEquals(CommitmentHash.hash(new int[] {1, 2}, 3L), CommitmentHash.hash(new int[] {1, 2, 3}, 0L)),
            () -> assertNotEquals(CommitmentHash.hash(new int[] {}, 0L), CommitmentHash.hash(new int[] {0}, 0L))
        );
    }
}
