package hu.advjava.zksudoku;

/**
 * The prover did not produce a usable commitment or opening for a round: it refused, or what it
 * sent could not be read. The verifier rejects that round.
 */
public class ProverRefusedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ProverRefusedException(String message) {
        super(message);
    }

    public ProverRefusedException(String message, Throwable cause) {
        super(message, cause);
    }
}
