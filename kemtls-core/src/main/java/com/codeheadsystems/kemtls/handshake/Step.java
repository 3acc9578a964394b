package com.codeheadsystems.kemtls.handshake;

import com.codeheadsystems.kemtls.codec.Frame;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of applying one event to a handshake context.
 *
 * @param context  the new context
 * @param outgoing frames the caller must send, in order
 * @param failure  present when this step moved the context to FAILED or was rejected
 */
public record Step(HandshakeContext context, List<Frame> outgoing, Optional<HandshakeFailure> failure) {

  public Step {
    Objects.requireNonNull(context, "context");
    outgoing = List.copyOf(outgoing);
    Objects.requireNonNull(failure, "failure");
  }

  static Step of(HandshakeContext context, Frame... outgoing) {
    return new Step(context, List.of(outgoing), Optional.empty());
  }

  static Step failed(HandshakeContext context, HandshakeFailure failure) {
    return new Step(context, List.of(), Optional.of(failure));
  }

  /**
   * Is failed.
   *
   * @return true when the step reported a failure
   */
  public boolean isFailed() {
    return failure.isPresent();
  }
}
