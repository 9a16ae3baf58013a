package hu.advjava.zksudoku;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

public class ProtocolConfigTest {
    @Test
    public void defaults() {
        var cfg = ProtocolConfig.from(key -> null);
        assertEquals(new ProtocolConfig(Protocol.DEFAULT_ROUNDS, ProtocolConfig.DEFAULT_THREADS), cfg);
    }

    @Test
    public void readsValues() {
        Map<String, String> env = Map.of("rounds", " 250 ", "threads", "3");
        assertEquals(new ProtocolConfig(250, 3), ProtocolConfig.from(env::get));
    }

    @Test
    public void rejectsBadValues() {
        assertAll(
            () -> assertThrows(IllegalStateException.class, () -> ProtocolConfig.from(Map.of("rounds", "0")::get)),
            () -> assertThrows(IllegalStateException.class, () -> ProtocolConfig.from(Map.of("threads", "-2")::get)),
            () -> assertThrows(IllegalStateException.class, () -> ProtocolConfig.from(Map.of("rounds", "many")::get))
        );
    }

    @Test
    public void systemPropertyWins() {
        System.setProperty("zksudoku.rounds", "42");
        try {
            assertEquals(42, ProtocolConfig.load().rounds());
        } finally {
            System.clearProperty("zksudoku.rounds");
        }
    }
}
