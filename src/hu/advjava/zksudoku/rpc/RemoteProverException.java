package hu.advjava.zksudoku.rpc;

/** The remote prover could not be reached, or the reply was not a JSON-RPC envelope. */
public class RemoteProverException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public RemoteProverException(String message) {
        super(message);
    }

    public RemoteProverException(String message, Throwable cause) {
        super(message, cause);
    }
}
