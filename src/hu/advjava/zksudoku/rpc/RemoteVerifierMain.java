package hu.advjava.zksudoku.rpc;

import java.net.URI;
import java.util.Arrays;

import hu.advjava.zksudoku.ExampleSudoku;
import hu.advjava.zksudoku.Protocol;
import hu.advjava.zksudoku.ProtocolConfig;

/** Runs the verifier against a prover server given by {@code PROVER_URL}. */
public class RemoteVerifierMain {

    public static void main(String[] args) throws Exception {
        String proverUrl = System.getenv("PROVER_URL");
        if (proverUrl == null || proverUrl.isBlank()) {
            throw new IllegalStateException("Set PROVER_URL as an environment variable, e.g. http://127.0.0.1:8080/prover");
        }
        var cfg = ProtocolConfig.load();
        var prover = new RemoteProver(new HttpTransport(URI.create(proverUrl)));

        // only proofs about the puzzle we know are worth anything
        if (!Arrays.equals(prover.puzzle(), ExampleSudoku.ZK_1.puzzleGrid())) {
            System.out.println("Prover claims a different puzzle, refusing to verify");
            System.exit(1);
        }

        var report = new Protocol(cfg.rounds()).runParallel(prover, cfg.threads());
        System.out.println(report.summary());
        System.exit(report.accepted() ? 0 : 1);
    }
}
