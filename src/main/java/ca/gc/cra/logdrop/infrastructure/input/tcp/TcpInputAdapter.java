package ca.gc.cra.logdrop.infrastructure.input.tcp;

import ca.gc.cra.logdrop.application.port.InputPort;
import ca.gc.cra.logdrop.application.port.MetricsPort;
import ca.gc.cra.logdrop.domain.value.LogRecord;
import ca.gc.cra.logdrop.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.logdrop.infrastructure.input.codec.RecordCodec;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> TCP listener decoding each connection into records.
 * <p><strong>Role:</strong> Input adapter implementing {@link InputPort}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Bind once and accept until closed; accept failures are logged and the loop continues.</li>
 *   <li>Serve each connection on its own {@code input-tcp-<n>} thread with a fresh codec.</li>
 *   <li>Block on the ingestion channel when the dispatcher falls behind, pushing back on the sender.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #run(BlockingQueue)} runs on the caller's thread; {@link #close()}
 * may be called from any thread.</p>
 * <p><strong>Observability:</strong> Emits {@code input.tcp.connections} and {@code input.tcp.records}.</p>
 *
 * @since 0.1.0
 */
public final class TcpInputAdapter implements InputPort {
  private static final Logger log = LoggerFactory.getLogger(TcpInputAdapter.class);

  public static final String DEFAULT_HOST = "::";
  public static final int DEFAULT_PORT = 10053;

  private final String host;
  private final int port;
  private final Supplier<RecordCodec> codecFactory;
  private final MetricsPort metrics;
  private final CountDownLatch bound = new CountDownLatch(1);
  private final Set<Socket> connections = ConcurrentHashMap.newKeySet();
  private final ExecutorService connectionPool;

  private volatile ServerSocket serverSocket;
  private volatile boolean closed;

  /**
   * Creates a TCP input.
   *
   * @param host bind address ({@code ::} for all interfaces)
   * @param port bind port; {@code 0} picks an ephemeral port
   * @param codecFactory supplies one codec per connection
   * @param metrics metrics sink
   */
  public TcpInputAdapter(String host, int port, Supplier<RecordCodec> codecFactory, MetricsPort metrics) {
    this.host = Objects.requireNonNull(host, "host");
    this.port = port;
    this.codecFactory = Objects.requireNonNull(codecFactory, "codecFactory");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.connectionPool = ExecutorFactories.newConnectionPool(
        "input-tcp", (thread, ex) -> log.error("TCP connection handler crashed", ex));
  }

  @Override
  public void run(BlockingQueue<LogRecord> sink) {
    Objects.requireNonNull(sink, "sink");
    ServerSocket server;
    try {
      server = new ServerSocket();
      server.setReuseAddress(true);
      server.bind(new InetSocketAddress(InetAddress.getByName(host), port));
    } catch (IOException ex) {
      log.error("TCP input cannot bind {}:{}", host, port, ex);
      return;
    }
    serverSocket = server;
    bound.countDown();
    log.info("TCP input listening on {}", server.getLocalSocketAddress());

    try {
      while (!closed && !Thread.currentThread().isInterrupted()) {
        Socket socket;
        try {
          socket = server.accept();
        } catch (SocketException ex) {
          if (closed || server.isClosed()) {
            break;
          }
          log.warn("TCP input accept failed", ex);
          continue;
        } catch (IOException ex) {
          log.warn("TCP input accept failed", ex);
          continue;
        }
        metrics.increment("input.tcp.connections");
        connections.add(socket);
        connectionPool.execute(() -> serve(socket, sink));
      }
    } finally {
      closeServer(server);
    }
  }

  private void serve(Socket socket, BlockingQueue<LogRecord> sink) {
    String peer = String.valueOf(socket.getRemoteSocketAddress());
    MDC.put("pipeline", "input-tcp");
    log.debug("Accepted connection from {}", peer);
    long count = 0;
    try (socket) {
      Iterator<LogRecord> records = codecFactory.get().decode(socket.getInputStream());
      while (records.hasNext()) {
        sink.put(records.next());
        metrics.increment("input.tcp.records");
        count++;
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    } catch (IOException ex) {
      if (!closed) {
        log.warn("Connection from {} failed", peer, ex);
      }
    } finally {
      connections.remove(socket);
      log.debug("Connection from {} closed after {} records", peer, count);
      MDC.remove("pipeline");
    }
  }

  /**
   * Waits until the listener is bound.
   *
   * @param timeout maximum wait
   * @return {@code true} if bound within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitBound(Duration timeout) throws InterruptedException {
    return bound.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Returns the bound port.
   *
   * @return local port, or {@code -1} before binding
   */
  public int localPort() {
    ServerSocket server = serverSocket;
    return server == null ? -1 : server.getLocalPort();
  }

  @Override
  public void close() {
    closed = true;
    ServerSocket server = serverSocket;
    if (server != null) {
      closeServer(server);
    }
    for (Socket socket : connections) {
      try {
        socket.close();
      } catch (IOException ex) {
        log.debug("Failed to close connection {}", socket.getRemoteSocketAddress(), ex);
      }
    }
    connectionPool.shutdownNow();
  }

  private static void closeServer(ServerSocket server) {
    try {
      server.close();
    } catch (IOException ex) {
      log.warn("Failed to close TCP listener", ex);
    }
  }
}
