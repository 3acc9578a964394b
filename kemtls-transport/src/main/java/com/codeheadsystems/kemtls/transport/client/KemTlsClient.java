package com.codeheadsystems.kemtls.transport.client;

import com.codeheadsystems.kemtls.common.RandomProvider;
import com.codeheadsystems.kemtls.crypto.KeyEncapsulation;
import com.codeheadsystems.kemtls.crypto.MlDsaSignature;
import com.codeheadsystems.kemtls.crypto.MlKemKeyEncapsulation;
import com.codeheadsystems.kemtls.crypto.Signature;
import com.codeheadsystems.kemtls.handshake.ClientHandshake;
import com.codeheadsystems.kemtls.handshake.Session;
import com.codeheadsystems.kemtls.transport.ByteStreamTransport;
import com.codeheadsystems.kemtls.transport.HandshakeDriver;
import com.codeheadsystems.kemtls.transport.SecureChannel;
import com.codeheadsystems.kemtls.transport.SocketTransport;
import com.codeheadsystems.kemtls.transport.config.KemTlsClientConfig;
import com.codeheadsystems.kemtls.transport.exceptions.KemTlsTransportException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens client KEMTLS sessions.
 * <p>
 * Each call runs a fresh handshake with a new ephemeral key; nothing is cached between
 * sessions. Connect failures are wrapped in {@link KemTlsTransportException}; handshake
 * failures surface as {@link com.codeheadsystems.kemtls.common.KemTlsException}.
 */
@Singleton
public class KemTlsClient {

  private static final Logger log = LoggerFactory.getLogger(KemTlsClient.class);

  private final KemTlsClientConfig config;
  private final KeyEncapsulation kem;
  private final Signature signature;
  private final RandomProvider randomProvider;
  private final HandshakeDriver driver;

  /**
   * Instantiates a client using the algorithms named in the config.
   *
   * @param config the config
   */
  @Inject
  public KemTlsClient(final KemTlsClientConfig config) {
    this(config, new RandomProvider());
  }

  private KemTlsClient(final KemTlsClientConfig config, final RandomProvider randomProvider) {
    this(config,
        MlKemKeyEncapsulation.fromName(config.kemAlgorithm(), randomProvider),
        MlDsaSignature.fromName(config.signatureAlgorithm(), randomProvider),
        randomProvider);
  }

  /**
   * Instantiates a client with explicit primitives.
   *
   * @param config         the config
   * @param kem            the key encapsulation
   * @param signature      the signature scheme used to verify server certificates
   * @param randomProvider source of client nonces
   */
  public KemTlsClient(final KemTlsClientConfig config,
                      final KeyEncapsulation kem,
                      final Signature signature,
                      final RandomProvider randomProvider) {
    log.info("KemTlsClient(kem={}, signature={})", kem.algorithm(), signature.algorithm());
    this.config = config;
    this.kem = kem;
    this.signature = signature;
    this.randomProvider = randomProvider;
    this.driver = new HandshakeDriver(config.wireCodec(), config.timeout());
  }

  /**
   * Connects to the configured host and port.
   *
   * @return the channel
   */
  public SecureChannel openClientSession() {
    return openClientSession(new InetSocketAddress(config.host(), config.port()));
  }

  /**
   * Connects and runs the client handshake.
   *
   * @param address the server address
   * @return the established channel
   */
  public SecureChannel openClientSession(final InetSocketAddress address) {
    log.debug("openClientSession(address={})", address);
    Socket socket = new Socket();
    SocketTransport transport;
    try {
      socket.connect(address, config.timeoutMillis().intValue());
      transport = new SocketTransport(socket);
    } catch (IOException e) {
      closeQuietly(socket);
      throw new KemTlsTransportException("Unable to connect to " + address, e);
    }
    return openClientSession(transport);
  }

  /**
   * Runs the client handshake over a caller-supplied transport.
   *
   * @param transport the transport; closed if the handshake fails
   * @return the established channel
   */
  public SecureChannel openClientSession(final ByteStreamTransport transport) {
    ClientHandshake handshake = new ClientHandshake(kem, signature, randomProvider, config.pinnedSubject());
    Session session = driver.run(handshake, transport);
    log.info("KEMTLS session established with {} ({})", transport.peer(),
        session.peerCertificate().map(c -> c.subject()).orElse("unknown subject"));
    return new SecureChannel(transport, session, config.wireCodec());
  }

  private static void closeQuietly(final Socket socket) {
    try {
      socket.close();
    } catch (IOException e) {
      log.debug("close() after failed connect: {}", e.getMessage());
    }
  }
}
