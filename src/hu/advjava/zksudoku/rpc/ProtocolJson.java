package hu.advjava.zksudoku.rpc;

import java.util.stream.IntStream;
import java.util.stream.LongStream;

import hu.advjava.zksudoku.PublicCommitment;
import hu.advjava.zksudoku.Request;
import hu.advjava.zksudoku.Response;
import jakarta.json.Json;
import jakarta.json.JsonArray;
import jakarta.json.JsonArrayBuilder;
import jakarta.json.JsonException;
import jakarta.json.JsonNumber;
import jakarta.json.JsonObject;
import jakarta.json.JsonString;

/**
 * JSON shapes of the protocol messages.
 *
 * <pre>
 * commitment: {"gridHashes": [81 hex strings], "mappingHash": hex}
 * request:    {"type": "values", "label": "row 0", "indices": [...]} | {"type": "mapping"}
 * response:   {"type": "values", "values": [...], "nonces": [...]}   | {"type": "mapping", "mapping": [...], "nonce": n}
 * </pre>
 *
 * Malformed input raises {@link IllegalArgumentException}.
 */
public final class ProtocolJson {
    private static final String VALUES = "values";
    private static final String MAPPING = "mapping";

    private ProtocolJson() {}

    /* -------------------- Commitment -------------------- */

    public static JsonObject toJson(PublicCommitment commitment) {
        JsonArrayBuilder hashes = Json.createArrayBuilder();
        for (String h : commitment.gridHashes()) hashes.add(h);
        return Json.createObjectBuilder()
                .add("gridHashes", hashes)
                .add("mappingHash", commitment.mappingHash())
                .build();
    }

    public static PublicCommitment commitmentFromJson(JsonObject json) {
        return ProtocolJson.<PublicCommitment>parse(() -> new PublicCommitment(
                json.getJsonArray("gridHashes").getValuesAs(JsonString.class).stream()
                        .map(JsonString::getString)
                        .toArray(String[]::new),
                json.getString("mappingHash")));
    }

    /* -------------------- Request -------------------- */

    public static JsonObject toJson(Request request) {
        return switch (request.kind()) {
            case MAPPING -> Json.createObjectBuilder().add("type", MAPPING).build();
            case VALUES -> {
                var sequence = (Request.IndexSequence) request;
                yield Json.createObjectBuilder()
                        .add("type", VALUES)
                        .add("label", sequence.label())
                        .add("indices", ints(sequence.indices()))
                        .build();
            }
        };
    }

    public static Request requestFromJson(JsonObject json) {
        return ProtocolJson.<Request>parse(() -> switch (json.getString("type", "")) {
            case MAPPING -> Request.RevealMapping.INSTANCE;
            case VALUES -> new Request.IndexSequence(json.getString("label", "values"), ints(json.getJsonArray("indices")));
            default -> throw new IllegalArgumentException("Unknown request type: " + json.getString("type", ""));
        });
    }

    /* -------------------- Response -------------------- */

    public static JsonObject toJson(Response response) {
        if (response instanceof Response.MappingReveal mapping) {
            return Json.createObjectBuilder()
                    .add("type", MAPPING)
                    .add("mapping", ints(mapping.mapping()))
                    .add("nonce", mapping.nonce())
                    .build();
        }
        var values = (Response.ValuesReveal) response;
        JsonArrayBuilder nonces = Json.createArrayBuilder();
        LongStream.of(values.nonces()).forEach(nonces::add);
        return Json.createObjectBuilder()
                .add("type", VALUES)
                .add("values", ints(values.values()))
                .add("nonces", nonces)
                .build();
    }

    public static Response responseFromJson(JsonObject json) {
        return ProtocolJson.<Response>parse(() -> switch (json.getString("type", "")) {
            case MAPPING -> new Response.MappingReveal(
                    ints(json.getJsonArray("mapping")), json.getJsonNumber("nonce").longValueExact());
            case VALUES -> new Response.ValuesReveal(
                    ints(json.getJsonArray("values")),
                    json.getJsonArray("nonces").getValuesAs(JsonNumber.class).stream()
                            .mapToLong(JsonNumber::longValueExact)
                            .toArray());
            default -> throw new IllegalArgumentException("Unknown response type: " + json.getString("type", ""));
        });
    }

    /* -------------------- helpers -------------------- */

    static JsonArray ints(int[] values) {
        JsonArrayBuilder ab = Json.createArrayBuilder();
        IntStream.of(values).forEach(ab::add);
        return ab.build();
    }

    static int[] ints(JsonArray arr) {
        return arr.getValuesAs(JsonNumber.class).stream().mapToInt(JsonNumber::intValueExact).toArray();
    }

    private interface Parser<T> {
        T parse();
    }

    // jakarta.json reports missing or mistyped members as NPE / ClassCastException / JsonException
    private static <T> T parse(Parser<T> parser) {
        try {
            return parser.parse();
        } catch (NullPointerException | ClassCastException | ArithmeticException | JsonException e) {
            throw new IllegalArgumentException("Malformed protocol message: " + e.getMessage(), e);
        }
    }
}
