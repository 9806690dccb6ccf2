package ca.gc.cra.logdrop.infrastructure.output.bulk;

import ca.gc.cra.logdrop.application.port.BulkTransport;
import ca.gc.cra.logdrop.logging.Logs;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.Result;
import org.eclipse.jetty.client.util.BufferingResponseListener;
import org.eclipse.jetty.client.util.StringContentProvider;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts bulk payloads as {@code application/x-ndjson} with Jetty's asynchronous {@link HttpClient}.
 *
 * <p>{@link #send(String)} returns once the request is queued. Responses are logged at DEBUG, connection failures
 * and non-2xx statuses at WARN; nothing is retried.</p>
 *
 * @since 0.1.0
 */
public final class JettyBulkTransport implements BulkTransport {
  private static final Logger log = LoggerFactory.getLogger(JettyBulkTransport.class);

  public static final String CONTENT_TYPE = "application/x-ndjson";

  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
  private static final int MAX_LOGGED_RESPONSE_BYTES = 1024;

  private final URI endpoint;
  private final HttpClient httpClient;

  /**
   * Creates and starts a transport for the supplied endpoint.
   *
   * @param endpoint bulk endpoint, e.g. {@code http://localhost:9200/logs/log/_bulk}
   * @throws IllegalStateException if the HTTP client cannot start
   */
  public JettyBulkTransport(URI endpoint) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.httpClient = new HttpClient();
    try {
      httpClient.start();
    } catch (Exception ex) {
      throw new IllegalStateException("Failed to start HTTP client for " + endpoint, ex);
    }
  }

  /**
   * Builds the conventional bulk endpoint {@code http://host:port/index/type/_bulk}.
   *
   * @param host server host
   * @param port server port
   * @param index index name
   * @param type document type
   * @return endpoint URI
   */
  public static URI endpoint(String host, int port, String index, String type) {
    String authority = host.indexOf(':') >= 0 && !host.startsWith("[") ? "[" + host + "]" : host;
    return URI.create("http://" + authority + ":" + port + "/" + index + "/" + type + "/_bulk");
  }

  @Override
  public void send(String payload) {
    int bytes = payload.length();
    httpClient.newRequest(endpoint)
        .method(HttpMethod.POST)
        .timeout(REQUEST_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)
        .content(new StringContentProvider(CONTENT_TYPE, payload, StandardCharsets.UTF_8), CONTENT_TYPE)
        .send(new BufferingResponseListener(MAX_LOGGED_RESPONSE_BYTES * 64) {
          @Override
          public void onComplete(Result result) {
            if (result.isFailed()) {
              log.warn("Bulk request to {} failed ({} chars)", endpoint, bytes, result.getFailure());
              return;
            }
            int status = result.getResponse().getStatus();
            if (HttpStatus.isSuccess(status)) {
              log.debug("Bulk request to {} answered {}", endpoint, status);
            } else {
              log.warn("Bulk request to {} answered {}: {}",
                  endpoint, status, Logs.truncate(getContentAsString(), MAX_LOGGED_RESPONSE_BYTES));
            }
          }
        });
  }

  public URI endpoint() {
    return endpoint;
  }

  @Override
  public void close() throws Exception {
    httpClient.stop();
  }
}
