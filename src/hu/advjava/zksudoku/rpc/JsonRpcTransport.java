package hu.advjava.zksudoku.rpc;

import jakarta.json.JsonObject;

/** Sends one JSON-RPC request envelope and returns the reply envelope. */
@FunctionalInterface
public interface JsonRpcTransport {
    JsonObject call(JsonObject request);
}
