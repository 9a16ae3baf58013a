package hu.advjava.zksudoku;

import java.security.SecureRandom;
import java.util.Random;

/** Picks the verifier's challenge uniformly from the catalogue. */
public final class Challenger {
    private final Random random;

    public Challenger() {
        this(new SecureRandom());
    }

    public Challenger(Random random) {
        this.random = random;
    }

    public Request nextChallenge(ChallengeCatalogue catalogue) {
        return catalogue.get(random.nextInt(catalogue.size()));
    }
}
