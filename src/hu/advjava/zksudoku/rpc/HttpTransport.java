package hu.advjava.zksudoku.rpc;

import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import jakarta.json.Json;
import jakarta.json.JsonException;
import jakarta.json.JsonObject;

/** POSTs JSON-RPC envelopes to a prover endpoint with {@link HttpClient}. */
public final class HttpTransport implements JsonRpcTransport {
    private final HttpClient http;
    private final URI endpoint;

    public HttpTransport(URI endpoint) {
        this.endpoint = endpoint;
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(15))
                .build();
    }

    @Override
    public JsonObject call(JsonObject request) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(Duration.ofSeconds(60))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(request.toString(), StandardCharsets.UTF_8))
                .build();
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (resp.statusCode() != 200)
                throw new RemoteProverException("HTTP " + resp.statusCode() + " from " + endpoint);
            try (var reader = Json.createReader(new StringReader(resp.body()))) {
                return reader.readObject();
            }
        } catch (IOException | JsonException e) {
            throw new RemoteProverException("Call to " + endpoint + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteProverException("Interrupted while calling " + endpoint, e);
        }
    }
}
