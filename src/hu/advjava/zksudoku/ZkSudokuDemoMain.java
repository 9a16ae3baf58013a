package hu.advjava.zksudoku;

import static java.util.Arrays.stream;

import java.util.Arrays;

public class ZkSudokuDemoMain {
    // The prover knows ZK_1's solution; the verifier only ever sees the puzzle.
    public static void main(String[] args) throws InterruptedException {
        var cfg = ProtocolConfig.load();
        var sudoku = ExampleSudoku.ZK_1;

        System.out.println("Puzzle:");
        stream(sudoku.getBoard()).map(Arrays::toString).forEach(System.out::println);

        var protocol = new Protocol(cfg.rounds());
        var report = protocol.runParallel(new HonestProver(sudoku.solutionGrid()), cfg.threads());
        System.out.println(report.summary());

        System.exit(report.accepted() ? 0 : 1);
    }
}
