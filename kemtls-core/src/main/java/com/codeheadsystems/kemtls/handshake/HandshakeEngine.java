package com.codeheadsystems.kemtls.handshake;

import com.codeheadsystems.kemtls.codec.Frame;
import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import java.security.MessageDigest;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pure KEMTLS handshake reducer. Given a context and one received frame it computes the next
 * context and the frames to send. It performs no I/O; randomness and primitives arrive through
 * injected capabilities, so fixed fakes make every step deterministic.
 * <p>
 * Rules shared by both roles:
 * <ul>
 *   <li>A FAILED context absorbs every message: the result is a PROTOCOL_VIOLATION and the
 *   context is returned unchanged.</li>
 *   <li>An ESTABLISHED context is final in the same way. A stray frame is reported as a
 *   PROTOCOL_VIOLATION but the context, and the session keys it shares with the handed-out
 *   {@link Session}, are left untouched.</li>
 *   <li>A received alert fails the handshake with CONNECTION_CLOSED.</li>
 *   <li>Structural and primitive errors become failures of the matching kind; nothing is
 *   retried.</li>
 * </ul>
 */
public abstract class HandshakeEngine {

  private static final Logger log = LoggerFactory.getLogger(HandshakeEngine.class);

  private final Role role;

  protected HandshakeEngine(Role role) {
    this.role = role;
  }

  /**
   * The role.
   *
   * @return the role
   */
  public Role role() {
    return role;
  }

  /**
   * A fresh context for this engine's role.
   *
   * @return the context
   */
  public HandshakeContext initialContext() {
    return HandshakeContext.idle(role);
  }

  /**
   * Starts the handshake from {@link ConnectionState#IDLE}. A client emits its ClientHello;
   * a server emits nothing and waits.
   *
   * @param context an idle context
   * @return the step
   */
  public abstract Step start(HandshakeContext context);

  /**
   * Applies one received frame.
   *
   * @param context the current context
   * @param frame   the received frame
   * @return the step
   */
  public Step step(HandshakeContext context, Frame frame) {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(frame, "frame");
    if (context.state() == ConnectionState.FAILED) {
      return Step.failed(context,
          new HandshakeFailure(FailureKind.PROTOCOL_VIOLATION, "Handshake already failed"));
    }
    if (context.state() == ConnectionState.ESTABLISHED) {
      log.debug("{} ignoring {} after the handshake completed", role, frame.type());
      return Step.failed(context,
          new HandshakeFailure(FailureKind.PROTOCOL_VIOLATION, "Handshake already established"));
    }
    log.debug("{} in {} received {}", role, context.state(), frame);
    try {
      return switch (frame.type()) {
        case ALERT -> fail(context, FailureKind.CONNECTION_CLOSED, "Peer sent an alert");
        case CLIENT_HELLO, SERVER_HELLO, SERVER_FINISHED, CLIENT_FINISHED, RECORD -> dispatch(context, frame);
      };
    } catch (KemTlsException e) {
      return fail(context, e.failureKind(), e.getMessage());
    }
  }

  /**
   * Forces the context to FAILED and wipes its secrets. A FAILED context is returned as is.
   * Aborting an ESTABLISHED context leaves the session keys intact since a {@link Session}
   * already holds them.
   *
   * @param context the context
   * @return the failed context
   */
  public HandshakeContext abort(HandshakeContext context) {
    if (context.state() == ConnectionState.FAILED) {
      return context;
    }
    log.debug("{} handshake aborted in {}", role, context.state());
    return context.failed(new HandshakeFailure(FailureKind.CONNECTION_CLOSED, "Handshake aborted"));
  }

  /**
   * Role-specific handling of a non-alert frame.
   *
   * @param context a context that is not FAILED
   * @param frame   the frame
   * @return the step
   * @throws KemTlsException for malformed payloads and primitive errors
   */
  protected abstract Step dispatch(HandshakeContext context, Frame frame);

  protected Step fail(HandshakeContext context, FailureKind kind, String message) {
    HandshakeFailure failure = new HandshakeFailure(kind, message);
    log.debug("{} handshake failed in {}: {} ({})", role, context.state(), kind, message);
    return Step.failed(context.failed(failure), failure);
  }

  protected Step unexpected(HandshakeContext context, Frame frame) {
    return fail(context, FailureKind.PROTOCOL_VIOLATION,
        "Unexpected " + frame.type() + " in state " + context.state());
  }

  protected static boolean macMatches(byte[] expected, byte[] received) {
    return MessageDigest.isEqual(expected, received);
  }
}
