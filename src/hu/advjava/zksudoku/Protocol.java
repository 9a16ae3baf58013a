package hu.advjava.zksudoku;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the verifier through repeated rounds against a prover.
 *
 * <p>A prover without a solution can answer at most 27 of the 28 challenges, so after R
 * rounds it escapes detection with probability at most (27/28)^R. The run stops at the
 * first rejected round. A prover that refuses to commit or to answer fails its round.
 */
public final class Protocol {
    private static final Logger log = LoggerFactory.getLogger(Protocol.class);

    public static final int DEFAULT_ROUNDS = 5000;

    /** Failure label for a round in which the prover never committed. */
    public static final String COMMITMENT = "commitment";

    private final ChallengeCatalogue catalogue;
    private final Challenger challenger;
    private final Verifier verifier;
    private final int rounds;

    public Protocol() {
        this(DEFAULT_ROUNDS);
    }

    public Protocol(int rounds) {
        this(rounds, ChallengeCatalogue.standard(), new Challenger(), new Verifier());
    }

    public Protocol(int rounds, ChallengeCatalogue catalogue, Challenger challenger, Verifier verifier) {
        if (rounds < 1) throw new IllegalArgumentException("At least one round is required, got " + rounds);
        this.rounds = rounds;
        this.catalogue = catalogue;
        this.challenger = challenger;
        this.verifier = verifier;
    }

    public int rounds() {
        return rounds;
    }

    public ChallengeCatalogue catalogue() {
        return catalogue;
    }

    public ProtocolReport run(Prover prover) {
        for (int round = 0; round < rounds; round++) {
            Optional<String> failed = runRound(prover, round);
            if (failed.isPresent()) {
                return ProtocolReport.rejected(rounds, round, failed.get());
            }
        }
        log.debug("All {} rounds passed", rounds);
        return ProtocolReport.accepted(rounds);
    }

    /**
     * Same as {@link #run(Prover)} with rounds spread over {@code threads} workers. The prover
     * must tolerate concurrent {@link Prover#beginRound()} calls.
     */
    public ProtocolReport runParallel(Prover prover, int threads) throws InterruptedException {
        if (threads < 1) throw new IllegalArgumentException("At least one thread is required, got " + threads);
        if (threads == 1) return run(prover);

        var nextRound = new AtomicInteger();
        var passed = new AtomicInteger();
        var failed = new AtomicBoolean();
        var failure = new AtomicReference<ProtocolReport.Failure>();

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> workers = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                workers.add(pool.submit(() -> {
                    int round;
                    while (!failed.get() && (round = nextRound.getAndIncrement()) < rounds) {
                        Optional<String> rejected = runRound(prover, round);
                        if (rejected.isPresent()) {
                            if (failed.compareAndSet(false, true))
                                failure.set(new ProtocolReport.Failure(round, rejected.get()));
                            return;
                        }
                        passed.incrementAndGet();
                    }
                }));
            }
            for (Future<?> worker : workers) {
                try {
                    worker.get();
                } catch (ExecutionException e) {
                    failed.set(true);
                    if (e.getCause() instanceof RuntimeException re) throw re;
                    throw new IllegalStateException("Protocol worker failed", e.getCause());
                }
            }
        } finally {
            pool.shutdownNow();
        }

        if (failed.get()) {
            return new ProtocolReport(false, rounds, passed.get(), Optional.of(failure.get()));
        }
        return ProtocolReport.accepted(rounds);
    }

    /** Returns the label of the challenge that failed, or empty if the round passed. */
    private Optional<String> runRound(Prover prover, int round) {
        Prover.Round proverRound;
        PublicCommitment commitment;
        try {
            proverRound = prover.beginRound();
            commitment = proverRound.commitment();
        } catch (ProverRefusedException e) {
            log.warn("Round {} rejected: no commitment ({})", round, e.getMessage());
            return Optional.of(COMMITMENT);
        }

        Request request = challenger.nextChallenge(catalogue);
        Response response;
        try {
            response = proverRound.reveal(request);
        } catch (ProverRefusedException e) {
            log.warn("Round {} rejected: challenge '{}' unanswered ({})", round, request.label(), e.getMessage());
            return Optional.of(request.label());
        }

        if (verifier.verify(request, response, commitment)) return Optional.empty();

        log.warn("Round {} rejected on challenge '{}'", round, request.label());
        return Optional.of(request.label());
    }
}
