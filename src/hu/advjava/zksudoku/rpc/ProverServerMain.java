package hu.advjava.zksudoku.rpc;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;

import org.glassfish.grizzly.http.server.HttpServer;
import org.glassfish.jersey.grizzly2.httpserver.GrizzlyHttpServerFactory;
import org.glassfish.jersey.jsonp.JsonProcessingFeature;
import org.glassfish.jersey.server.ResourceConfig;
import org.glassfish.jersey.server.ServerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hu.advjava.zksudoku.ExampleSudoku;
import hu.advjava.zksudoku.HonestProver;

/** Serves the prover for {@link ExampleSudoku#ZK_1} at {@code ZK_BIND_URL} (default http://127.0.0.1:8080). */
public class ProverServerMain {
    private static final Logger log = LoggerFactory.getLogger(ProverServerMain.class);
    private static final String DEFAULT_BIND_URL = "http://127.0.0.1:8080";

    public static void main(String[] args) throws Exception {
        String bindUrl = System.getenv("ZK_BIND_URL");
        if (bindUrl == null || bindUrl.isBlank()) bindUrl = DEFAULT_BIND_URL;

        var resource = new ProverResource(ExampleSudoku.ZK_1, new HonestProver(ExampleSudoku.ZK_1.solutionGrid()),
                roundTimeout(), Clock.systemUTC());
        HttpServer server = runServer(bindUrl, resource);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.shutdownNow();
            resource.close();
        }));
        log.info("Prover listening on {}/prover", bindUrl);

        Thread.currentThread().join();
    }

	// ZK_ROUND_TIMEOUT_SECONDS: how long an unrevealed round is kept
	private static Duration roundTimeout() {
		String raw = System.getenv("ZK_ROUND_TIMEOUT_SECONDS");
		if (raw == null || raw.isBlank()) return ProverResource.DEFAULT_ROUND_TIMEOUT;
		try {
			return Duration.ofSeconds(Long.parseLong(raw.trim()));
		} catch (NumberFormatException e) {
			throw new IllegalStateException("Set ZK_ROUND_TIMEOUT_SECONDS to a number of seconds, got '" + raw + "'", e);
		}
	}

	static HttpServer runServer(String baseUri, ProverResource resource) {
		ResourceConfig rc = new ResourceConfig()
	        .register(resource) // one instance: it owns the open rounds
	        .register(JsonProcessingFeature.class)
	        .property(ServerProperties.WADL_FEATURE_DISABLE, true);
		return GrizzlyHttpServerFactory.createHttpServer(URI.create(baseUri), rc);
	}
}
