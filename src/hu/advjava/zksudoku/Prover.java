package hu.advjava.zksudoku;

/**
 * The prover side of the protocol. Each call to {@link #beginRound()} permutes and commits
 * afresh; the returned round answers exactly one challenge.
 *
 * <p>Implementations throw {@link ProverRefusedException} when the prover cannot commit or
 * cannot answer; any other exception is a fault outside the protocol.
 */
public interface Prover {

    Round beginRound();

    interface Round {
        PublicCommitment commitment();

        Response reveal(Request request);
    }
}
