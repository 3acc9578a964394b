package com.codeheadsystems.kemtls.transport.server;

import com.codeheadsystems.kemtls.certificate.ServerIdentity;
import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import com.codeheadsystems.kemtls.common.RandomProvider;
import com.codeheadsystems.kemtls.crypto.KeyEncapsulation;
import com.codeheadsystems.kemtls.crypto.MlDsaSignature;
import com.codeheadsystems.kemtls.crypto.MlKemKeyEncapsulation;
import com.codeheadsystems.kemtls.handshake.ServerHandshake;
import com.codeheadsystems.kemtls.handshake.Session;
import com.codeheadsystems.kemtls.transport.ByteStreamTransport;
import com.codeheadsystems.kemtls.transport.HandshakeDriver;
import com.codeheadsystems.kemtls.transport.SecureChannel;
import com.codeheadsystems.kemtls.transport.SocketTransport;
import com.codeheadsystems.kemtls.transport.config.KemTlsServerConfig;
import com.codeheadsystems.kemtls.transport.exceptions.KemTlsTransportException;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * KEMTLS server: accepts connections on a dedicated thread and serves each one on a bounded
 * worker pool.
 * <p>
 * Per connection: server handshake with the shared {@link ServerIdentity}, then a loop of
 * receive, {@link RequestHandler#handle(byte[])}, send. A handler exception sends a generic
 * failure alert and closes that connection only. Connections beyond the pool's queue are
 * closed immediately.
 */
public class KemTlsServer implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(KemTlsServer.class);

  /**
   * Pending connections allowed per worker thread before new ones are refused.
   */
  private static final int QUEUE_PER_WORKER = 16;

  private final KemTlsServerConfig config;
  private final ServerIdentity identity;
  private final KeyEncapsulation kem;
  private final RandomProvider randomProvider;
  private final RequestHandler handler;
  private final HandshakeDriver driver;
  private final ExecutorService workers;
  private final Set<ByteStreamTransport> connections = ConcurrentHashMap.newKeySet();

  private volatile ServerSocket serverSocket;
  private volatile boolean running;
  private Thread acceptor;

  /**
   * Instantiates a new KEMTLS server.
   *
   * @param config         the config
   * @param identity       long-term credentials, shared read-only by every connection
   * @param kem            the key encapsulation
   * @param randomProvider source of server nonces
   * @param handler        the request handler
   * @throws com.codeheadsystems.kemtls.common.KemTlsException if the identity's KEM keys do not match
   */
  public KemTlsServer(final KemTlsServerConfig config,
                      final ServerIdentity identity,
                      final KeyEncapsulation kem,
                      final RandomProvider randomProvider,
                      final RequestHandler handler) {
    identity.checkKemKeyPair(kem);
    this.config = config;
    this.identity = identity;
    this.kem = kem;
    this.randomProvider = randomProvider;
    this.handler = handler;
    this.driver = new HandshakeDriver(config.wireCodec(), config.timeout());
    AtomicInteger threadCount = new AtomicInteger();
    this.workers = new ThreadPoolExecutor(config.workerThreads(), config.workerThreads(),
        0L, TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(config.workerThreads() * QUEUE_PER_WORKER),
        r -> {
          Thread t = new Thread(r, "kemtls-worker-" + threadCount.incrementAndGet());
          t.setDaemon(true);
          return t;
        });
  }

  /**
   * Builds a server with ML-KEM/ML-DSA adapters named by the config and a freshly generated
   * identity.
   *
   * @param config  the config
   * @param handler the request handler
   * @return the server, not yet started
   */
  public static KemTlsServer create(final KemTlsServerConfig config, final RequestHandler handler) {
    RandomProvider randomProvider = new RandomProvider();
    KeyEncapsulation kem = MlKemKeyEncapsulation.fromName(config.kemAlgorithm(), randomProvider);
    ServerIdentity identity = ServerIdentity.generate(config.subject(), kem,
        MlDsaSignature.fromName(config.signatureAlgorithm(), randomProvider));
    return new KemTlsServer(config, identity, kem, randomProvider, handler);
  }

  /**
   * Binds and starts accepting.
   *
   * @return this server
   * @throws KemTlsTransportException if the socket cannot be bound
   */
  public synchronized KemTlsServer start() {
    if (running) {
      throw new IllegalStateException("Server already started");
    }
    try {
      serverSocket = new ServerSocket(config.port(), 50, InetAddress.getByName(config.host()));
    } catch (IOException e) {
      throw new KemTlsTransportException("Unable to bind " + config.host() + ":" + config.port(), e);
    }
    running = true;
    acceptor = new Thread(this::acceptLoop, "kemtls-acceptor");
    acceptor.setDaemon(true);
    acceptor.start();
    log.info("KEMTLS server listening on {}:{} (kem={}, subject={})", config.host(), port(),
        kem.algorithm(), identity.certificate().subject());
    return this;
  }

  /**
   * The bound port, useful when configured with port 0.
   *
   * @return the port
   */
  public int port() {
    ServerSocket socket = serverSocket;
    if (socket == null) {
      throw new IllegalStateException("Server not started");
    }
    return socket.getLocalPort();
  }

  /**
   * The server identity.
   *
   * @return the identity
   */
  public ServerIdentity identity() {
    return identity;
  }

  /**
   * Runs the server handshake over a caller-owned transport.
   *
   * @param transport the transport; closed if the handshake fails
   * @return the established channel
   */
  public SecureChannel acceptServerSession(final ByteStreamTransport transport) {
    Session session = driver.run(new ServerHandshake(kem, identity, randomProvider), transport);
    log.info("KEMTLS session established with {}", transport.peer());
    return new SecureChannel(transport, session, config.wireCodec());
  }

  private void acceptLoop() {
    while (running) {
      Socket socket;
      try {
        socket = serverSocket.accept();
      } catch (SocketException e) {
        if (running) {
          log.warn("Accept failed: {}", e.getMessage());
        }
        continue;
      } catch (IOException e) {
        log.warn("Accept failed: {}", e.getMessage());
        continue;
      }
      try {
        workers.execute(() -> serve(socket));
      } catch (RejectedExecutionException e) {
        log.warn("Refusing connection from {}: worker pool saturated", socket.getRemoteSocketAddress());
        closeQuietly(socket);
      }
    }
  }

  private void serve(final Socket socket) {
    SocketTransport transport;
    try {
      transport = new SocketTransport(socket);
    } catch (IOException e) {
      log.warn("Could not open streams for {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
      closeQuietly(socket);
      return;
    }
    connections.add(transport);
    try {
      SecureChannel channel = acceptServerSession(transport);
      while (channel.isOpen()) {
        byte[] request = channel.receive();
        byte[] response;
        try {
          response = handler.handle(request);
        } catch (RuntimeException e) {
          log.warn("Handler failed for {}: {}", transport.peer(), e.toString());
          channel.abort();
          return;
        }
        channel.send(response);
      }
    } catch (KemTlsException e) {
      if (e.failureKind() == FailureKind.CONNECTION_CLOSED) {
        log.debug("Connection from {} closed: {}", transport.peer(), e.getMessage());
      } else {
        log.warn("Connection from {} failed: {}", transport.peer(), e.failureKind());
      }
    } finally {
      connections.remove(transport);
      transport.close();
    }
  }

  /**
   * Stops accepting, closes open connections and shuts the workers down.
   */
  @Override
  public synchronized void close() {
    if (!running) {
      return;
    }
    running = false;
    try {
      serverSocket.close();
    } catch (IOException e) {
      log.debug("Server socket close failed: {}", e.getMessage());
    }
    connections.forEach(ByteStreamTransport::close);
    workers.shutdownNow();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Workers did not terminate within 5 seconds");
      }
      acceptor.join(TimeUnit.SECONDS.toMillis(5));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    log.info("KEMTLS server on port {} stopped", serverSocket.getLocalPort());
  }

  private static void closeQuietly(final Socket socket) {
    try {
      socket.close();
    } catch (IOException e) {
      log.debug("close() failed: {}", e.getMessage());
    }
  }
}
