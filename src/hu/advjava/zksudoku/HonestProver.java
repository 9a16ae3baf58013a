package hu.advjava.zksudoku;

import java.util.concurrent.atomic.AtomicBoolean;

/** A prover that really knows the solution and answers every challenge truthfully. */
public final class HonestProver implements Prover {
    private final int[] solution;
    private final Permuter permuter;
    private final Committer committer;
    private final Revealer revealer = new Revealer();

    public HonestProver(int[] solution) {
        this(solution, new Permuter(), new Committer());
    }

    public HonestProver(int[] solution, Permuter permuter, Committer committer) {
        this.solution = Grids.requireSolved(solution).clone();
        this.permuter = permuter;
        this.committer = committer;
    }

    @Override
    public Round beginRound() {
        Permutation permutation = permuter.permute(solution);
        return new HonestRound(permutation, committer.commit(permutation));
    }

    private final class HonestRound implements Round {
        private final Permutation permutation;
        private final Commitment commitment;
        private final AtomicBoolean revealed = new AtomicBoolean();

        HonestRound(Permutation permutation, Commitment commitment) {
            this.permutation = permutation;
            this.commitment = commitment;
        }

        @Override
        public PublicCommitment commitment() {
            return commitment.publicPart();
        }

        @Override
        public Response reveal(Request request) {
            if (!revealed.compareAndSet(false, true))
                throw new IllegalStateException("Round already answered a challenge");
            return revealer.reveal(permutation, commitment, request);
        }
    }
}
