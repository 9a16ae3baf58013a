package hu.advjava.zksudoku.rpc;

import java.util.concurrent.atomic.AtomicInteger;

import hu.advjava.zksudoku.Prover;
import hu.advjava.zksudoku.ProverRefusedException;
import hu.advjava.zksudoku.PublicCommitment;
import hu.advjava.zksudoku.Request;
import hu.advjava.zksudoku.Response;
import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.json.JsonObjectBuilder;

/** A {@link Prover} on the other side of a {@link JsonRpcTransport}, e.g. a {@link ProverResource}. */
public final class RemoteProver implements Prover {
    private final JsonRpcTransport transport;
    private final AtomicInteger ids = new AtomicInteger();

    public RemoteProver(JsonRpcTransport transport) {
        this.transport = transport;
    }

    /** Asks the prover which puzzle it claims to have solved. */
    public int[] puzzle() {
        return ProtocolJson.ints(call("initialize", Json.createObjectBuilder()).getJsonArray("board"));
    }

    @Override
    public Round beginRound() {
        JsonObject result = call("round/commit", Json.createObjectBuilder());
        try {
            String roundId = result.getString("roundId");
            PublicCommitment commitment = ProtocolJson.commitmentFromJson(result.getJsonObject("commitment"));
            return new RemoteRound(roundId, commitment);
        } catch (NullPointerException | ClassCastException | IllegalArgumentException e) {
            throw new ProverRefusedException("round/commit returned an unreadable commitment", e);
        }
    }

    /**
     * Error envelopes and unreadable results are the prover's doing and raise
     * {@link ProverRefusedException}; the transport raises {@link RemoteProverException}.
     */
    private JsonObject call(String method, JsonObjectBuilder params) {
        int id = ids.incrementAndGet();
        JsonObject reply = transport.call(Json.createObjectBuilder()
                .add("jsonrpc", "2.0")
                .add("id", id)
                .add("method", method)
                .add("params", params)
                .build());

        JsonObject error = reply.getJsonObject("error");
        if (error != null) {
            throw new ProverRefusedException(method + " failed (" + error.getInt("code", 0) + "): "
                    + error.getString("message", ""));
        }
        JsonObject result = reply.getJsonObject("result");
        if (result == null) throw new ProverRefusedException(method + " returned no result");
        return result;
    }

    private final class RemoteRound implements Round {
        private final String roundId;
        private final PublicCommitment commitment;

        RemoteRound(String roundId, PublicCommitment commitment) {
            this.roundId = roundId;
            this.commitment = commitment;
        }

        @Override
        public PublicCommitment commitment() {
            return commitment;
        }

        @Override
        public Response reveal(Request request) {
            JsonObject result = call("round/reveal", Json.createObjectBuilder()
                    .add("roundId", roundId)
                    .add("request", ProtocolJson.toJson(request)));
            try {
                return ProtocolJson.responseFromJson(result.getJsonObject("response"));
            } catch (NullPointerException | ClassCastException | IllegalArgumentException e) {
                throw new ProverRefusedException("round/reveal returned an unreadable response", e);
            }
        }
    }
}
