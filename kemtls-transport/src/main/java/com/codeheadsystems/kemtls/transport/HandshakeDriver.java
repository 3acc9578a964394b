package com.codeheadsystems.kemtls.transport;

import com.codeheadsystems.kemtls.codec.Alert;
import com.codeheadsystems.kemtls.codec.Frame;
import com.codeheadsystems.kemtls.codec.WireCodec;
import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import com.codeheadsystems.kemtls.handshake.HandshakeContext;
import com.codeheadsystems.kemtls.handshake.HandshakeEngine;
import com.codeheadsystems.kemtls.handshake.Session;
import com.codeheadsystems.kemtls.handshake.Step;
import java.io.IOException;
import java.io.OutputStream;
import java.net.SocketTimeoutException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link HandshakeEngine} over a {@link ByteStreamTransport} until the session is
 * established or the handshake fails.
 * <p>
 * On failure the driver aborts the engine context, sends a generic failure alert (best effort),
 * closes the transport and throws a {@link KemTlsException} carrying the local failure kind.
 * The alert never says which check failed.
 */
public class HandshakeDriver {

  private static final Logger log = LoggerFactory.getLogger(HandshakeDriver.class);

  private final WireCodec codec;
  private final Duration readTimeout;

  /**
   * Instantiates a new Handshake driver.
   *
   * @param codec       frame codec with the configured size bound
   * @param readTimeout bound on each read while handshaking
   */
  public HandshakeDriver(final WireCodec codec, final Duration readTimeout) {
    this.codec = codec;
    this.readTimeout = readTimeout;
  }

  /**
   * Runs the handshake.
   *
   * @param engine    the client or server engine
   * @param transport the transport; closed on failure
   * @return the established session
   * @throws KemTlsException on any failure, with TIMEOUT for an expired read and
   *                         CONNECTION_CLOSED for EOF or I/O errors
   */
  public Session run(final HandshakeEngine engine, final ByteStreamTransport transport) {
    log.debug("run(role={}, peer={})", engine.role(), transport.peer());
    HandshakeContext context = engine.initialContext();
    try {
      transport.setReadTimeout(readTimeout);
      context = apply(engine.start(context), transport);
      while (!context.isEstablished()) {
        Frame frame = codec.readFrame(transport.inputStream());
        context = apply(engine.step(context, frame), transport);
      }
      Session session = context.session().orElseThrow();
      log.debug("{} handshake complete with {}", engine.role(), transport.peer());
      return session;
    } catch (KemTlsException e) {
      throw failed(engine, context, transport, e.failureKind(), e.getMessage(), e);
    } catch (SocketTimeoutException e) {
      throw failed(engine, context, transport, FailureKind.TIMEOUT, "Handshake read timed out", e);
    } catch (IOException e) {
      throw failed(engine, context, transport, FailureKind.CONNECTION_CLOSED,
          "Connection lost during handshake: " + e.getMessage(), e);
    }
  }

  private HandshakeContext apply(final Step step, final ByteStreamTransport transport) throws IOException {
    if (step.failure().isPresent()) {
      throw step.failure().get().toException();
    }
    if (!step.outgoing().isEmpty()) {
      OutputStream out = transport.outputStream();
      for (Frame frame : step.outgoing()) {
        out.write(codec.encode(frame.type(), frame.payload()));
      }
      out.flush();
    }
    return step.context();
  }

  private KemTlsException failed(final HandshakeEngine engine,
                                 final HandshakeContext context,
                                 final ByteStreamTransport transport,
                                 final FailureKind kind,
                                 final String message,
                                 final Exception cause) {
    engine.abort(context);
    log.warn("{} handshake with {} failed: {}", engine.role(), transport.peer(), kind);
    log.debug("Handshake failure detail: {}", message);
    sendAlert(transport, Alert.FAILURE);
    transport.close();
    return new KemTlsException(kind, message, cause);
  }

  /**
   * Writes an alert, ignoring I/O errors since the connection is being torn down anyway.
   *
   * @param transport the transport
   * @param alert     the alert
   */
  static void sendAlert(final ByteStreamTransport transport, final Alert alert) {
    try {
      OutputStream out = transport.outputStream();
      out.write(alert.toFrame().encode());
      out.flush();
    } catch (IOException | RuntimeException e) {
      log.debug("Could not send alert to {}: {}", transport.peer(), e.getMessage());
    }
  }
}
