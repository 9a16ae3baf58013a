package hu.advjava.zksudoku.rpc;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hu.advjava.zksudoku.ExampleSudoku;
import hu.advjava.zksudoku.HonestProver;
import hu.advjava.zksudoku.Prover;
import hu.advjava.zksudoku.Response;
import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;

/**
 * JSON-RPC 2.0 endpoint for the prover side of the protocol.
 *
 * <ul>
 *   <li>{@code initialize}: server info and the public puzzle</li>
 *   <li>{@code round/commit}: permute, commit, return {@code {roundId, commitment}}</li>
 *   <li>{@code round/reveal} {@code {roundId, request}}: answer the challenge and close the round</li>
 * </ul>
 *
 * Register a single instance: open rounds live in this object. A round that is not revealed
 * within the round timeout is dropped; {@link #close()} stops the cleaner.
 */
@Path("/prover")
public class ProverResource implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProverResource.class);

    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;
    static final int SERVER_ERROR = -32000;
    static final int MAX_OPEN_ROUNDS = 1024;
    public static final Duration DEFAULT_ROUND_TIMEOUT = Duration.ofSeconds(120);
    private static final long CLEANUP_INTERVAL_SECONDS = 60;

    private record OpenRound(Prover.Round round, Instant expiresAt) {}

    private final ExampleSudoku sudoku;
    private final Prover prover;
    private final Duration roundTimeout;
    private final Clock clock;
    private final Map<String, OpenRound> openRounds = new ConcurrentHashMap<>();
    private final ScheduledExecutorService cleaner = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "prover-round-cleaner");
        t.setDaemon(true);
        return t;
    });

    public ProverResource(ExampleSudoku sudoku) {
        this(sudoku, new HonestProver(sudoku.solutionGrid()));
    }

    public ProverResource(ExampleSudoku sudoku, Prover prover) {
        this(sudoku, prover, DEFAULT_ROUND_TIMEOUT, Clock.systemUTC());
    }

    public ProverResource(ExampleSudoku sudoku, Prover prover, Duration roundTimeout, Clock clock) {
        if (roundTimeout.isNegative() || roundTimeout.isZero())
            throw new IllegalArgumentException("Round timeout must be positive, got " + roundTimeout);
        this.sudoku = sudoku;
        this.prover = prover;
        this.roundTimeout = roundTimeout;
        this.clock = clock;
        cleaner.scheduleAtFixedRate(this::cleanup, CLEANUP_INTERVAL_SECONDS, CLEANUP_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    /** Drops rounds whose reveal deadline has passed. */
    void cleanup() {
        Instant now = clock.instant();
        int before = openRounds.size();
        openRounds.values().removeIf(r -> r.expiresAt().isBefore(now));
        int dropped = before - openRounds.size();
        if (dropped > 0) log.info("Dropped {} abandoned rounds", dropped);
    }

    @Override
    public void close() {
        cleaner.shutdownNow();
    }

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public JsonObject getInfo(@Context HttpHeaders headers, @Context UriInfo ui) {
        log.info("GET {} Accept={}", ui.getRequestUri(), headers.getHeaderString("Accept"));
        return Json.createObjectBuilder()
                .add("ok", true)
                .add("endpoint", "/prover")
                .add("hint", "POST JSON-RPC here: initialize, round/commit, round/reveal")
                .build();
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public JsonObject handleJson(JsonObject request) {
        return dispatch(request);
    }

    /* -------------------- Core dispatcher -------------------- */
    public JsonObject dispatch(JsonObject request) {
    	String method = request.getString("method", "");
    	int id = request.getInt("id", -1);

    	log.debug("RPC <- {} (id={})", method, id);
    	try {
    		switch (method) {
    		case "initialize":
    			return okEnvelope(id, Json.createObjectBuilder()
    					.add("serverInfo", Json.createObjectBuilder()
    							.add("name", "ZkSudokuProver")
    							.add("version", "1.0"))
    					.add("puzzle", sudoku.name())
    					.add("board", ProtocolJson.ints(sudoku.puzzleGrid()))
    					.build());

    		case "round/commit": {
    			if (openRounds.size() >= MAX_OPEN_ROUNDS) cleanup();
    			if (openRounds.size() >= MAX_OPEN_ROUNDS)
    				return errorEnvelope(id, SERVER_ERROR, "Too many open rounds");
    			Prover.Round round = prover.beginRound();
    			String roundId = UUID.randomUUID().toString();
    			openRounds.put(roundId, new OpenRound(round, clock.instant().plus(roundTimeout)));
    			return okEnvelope(id, Json.createObjectBuilder()
    					.add("roundId", roundId)
    					.add("commitment", ProtocolJson.toJson(round.commitment()))
    					.build());
    		}

    		case "round/reveal": {
    			JsonObject params = request.getJsonObject("params");
    			if (params == null) return errorEnvelope(id, INVALID_PARAMS, "Missing params");
    			String roundId = params.getString("roundId", "");
    			// a round answers one challenge only
    			OpenRound open = openRounds.remove(roundId);
    			if (open == null || open.expiresAt().isBefore(clock.instant()))
    				return errorEnvelope(id, INVALID_PARAMS, "Unknown or expired round: " + roundId);
    			JsonObject challenge = params.getJsonObject("request");
    			if (challenge == null) return errorEnvelope(id, INVALID_PARAMS, "Missing request");
    			Response response = open.round().reveal(ProtocolJson.requestFromJson(challenge));
    			return okEnvelope(id, Json.createObjectBuilder()
    					.add("response", ProtocolJson.toJson(response))
    					.build());
    		}

    		default:
    			return errorEnvelope(id, METHOD_NOT_FOUND, "Method not found: " + method);
    		}
    	} catch (IllegalArgumentException | IndexOutOfBoundsException | ClassCastException e) {
    		log.info("Rejected {} (id={}): {}", method, id, e.getMessage());
    		return errorEnvelope(id, INVALID_PARAMS, "Invalid params: " + e.getMessage());
    	} catch (RuntimeException e) {
    		log.error("Failed {} (id={})", method, id, e);
    		return errorEnvelope(id, SERVER_ERROR, "Server error: " + e.getMessage());
    	}
    }

    int openRoundCount() {
        return openRounds.size();
    }

    /* -------------------- JSON helpers -------------------- */

    static JsonObject okEnvelope(int id, JsonObject result) {
        return Json.createObjectBuilder()
                .add("jsonrpc", "2.0")
                .add("id", id)
                .add("result", result)
                .build();
    }

    static JsonObject errorEnvelope(int id, int code, String message) {
        return Json.createObjectBuilder()
                .add("jsonrpc", "2.0")
                .add("id", id)
                .add("error", Json.createObjectBuilder()
                        .add("code", code)
                        .add("message", message))
                .build();
    }
}
