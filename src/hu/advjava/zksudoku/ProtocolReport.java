package hu.advjava.zksudoku;

import java.util.Optional;

/**
 * Outcome of a protocol run.
 *
 * @param failure the round that was rejected, if any
 */
public record ProtocolReport(boolean accepted, int roundsRequested, int roundsPassed, Optional<Failure> failure) {

    /** @param round zero-based index of the rejected round */
    public record Failure(int round, String challenge) {}

    public static ProtocolReport accepted(int rounds) {
        return new ProtocolReport(true, rounds, rounds, Optional.empty());
    }

    /** Serial runs pass every round before the rejected one. */
    public static ProtocolReport rejected(int rounds, int round, String challenge) {
        return new ProtocolReport(false, rounds, round, Optional.of(new Failure(round, challenge)));
    }

    /** Chance that a prover without a solution survives every round: at best it fools 27 of 28 challenges. */
    public double falseAcceptBound() {
        return Math.pow(27.0 / 28.0, roundsRequested);
    }

    /** {@code -log2} of {@link #falseAcceptBound()}, computed without underflow. */
    public double soundnessBits() {
        return -roundsRequested * (Math.log(27.0 / 28.0) / Math.log(2));
    }

    public String summary() {
        if (accepted) {
            return "ACCEPTED after %d rounds (false-accept probability <= 2^-%.1f)".formatted(roundsPassed, soundnessBits());
        }
        var f = failure.orElseThrow();
        return "REJECTED in round %d of %d on challenge '%s' (%d rounds passed)"
                .formatted(f.round() + 1, roundsRequested, f.challenge(), roundsPassed);
    }
}
