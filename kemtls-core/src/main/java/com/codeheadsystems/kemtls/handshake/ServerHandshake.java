package com.codeheadsystems.kemtls.handshake;

import com.codeheadsystems.kemtls.certificate.ServerIdentity;
import com.codeheadsystems.kemtls.codec.ClientFinished;
import com.codeheadsystems.kemtls.codec.ClientHello;
import com.codeheadsystems.kemtls.codec.Frame;
import com.codeheadsystems.kemtls.codec.ServerFinished;
import com.codeheadsystems.kemtls.codec.ServerHello;
import com.codeheadsystems.kemtls.common.ByteUtils;
import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import com.codeheadsystems.kemtls.common.RandomProvider;
import com.codeheadsystems.kemtls.crypto.Encapsulation;
import com.codeheadsystems.kemtls.crypto.Hkdf;
import com.codeheadsystems.kemtls.crypto.KeyEncapsulation;
import com.codeheadsystems.kemtls.crypto.KeySchedule;
import com.codeheadsystems.kemtls.crypto.SessionKeys;
import java.util.Objects;

/**
 * Server side of the KEMTLS handshake.
 * <pre>
 *   IDLE --ClientHello/ServerHello,ServerFinished--> AWAIT_FINISHED
 *   AWAIT_FINISHED --ClientFinished--> ESTABLISHED
 * </pre>
 * The {@link ServerIdentity} is shared read-only across every connection.
 */
public class ServerHandshake extends HandshakeEngine {

  private final KeyEncapsulation kem;
  private final ServerIdentity identity;
  private final RandomProvider randomProvider;
  private final KeySchedule keySchedule;

  /**
   * Instantiates a new Server handshake.
   *
   * @param kem            the key encapsulation
   * @param identity       the server identity
   * @param randomProvider source of the server nonce
   */
  public ServerHandshake(KeyEncapsulation kem, ServerIdentity identity, RandomProvider randomProvider) {
    super(Role.SERVER);
    this.kem = kem;
    this.identity = Objects.requireNonNull(identity, "identity");
    this.randomProvider = randomProvider;
    this.keySchedule = KeySchedule.forKem(kem);
  }

  @Override
  public Step start(HandshakeContext context) {
    if (context.state() != ConnectionState.IDLE) {
      return context.state() == ConnectionState.FAILED
          ? Step.failed(context, new HandshakeFailure(FailureKind.PROTOCOL_VIOLATION, "Handshake already failed"))
          : fail(context, FailureKind.PROTOCOL_VIOLATION, "Handshake already started");
    }
    return Step.of(context);
  }

  @Override
  protected Step dispatch(HandshakeContext context, Frame frame) {
    return switch (frame.type()) {
      case CLIENT_HELLO -> context.state() == ConnectionState.IDLE
          ? onClientHello(context, frame)
          : unexpected(context, frame);
      case CLIENT_FINISHED -> context.state() == ConnectionState.AWAIT_FINISHED
          ? onClientFinished(context, frame)
          : unexpected(context, frame);
      case SERVER_HELLO, SERVER_FINISHED, RECORD, ALERT -> unexpected(context, frame);
    };
  }

  private Step onClientHello(HandshakeContext context, Frame frame) {
    ClientHello clientHello = ClientHello.parse(frame.payload());
    Encapsulation encapsulation = encapsulate(clientHello.ephemeralPublicKey());
    byte[] serverNonce = randomProvider.randomBytes(ServerHello.NONCE_LENGTH);
    SessionKeys keys;
    try {
      keys = keySchedule.derive(encapsulation.sharedSecret(), clientHello.clientNonce(), serverNonce);
    } finally {
      ByteUtils.wipe(encapsulation.sharedSecret());
    }
    Frame serverHello = new ServerHello(encapsulation.ciphertext(), serverNonce, identity.certificate()).toFrame();
    byte[] transcript = ByteUtils.concat(frame.encode(), serverHello.encode());
    byte[] macKey = keys.macKey();
    try {
      Frame serverFinished = new ServerFinished(Hkdf.hmacSha256(macKey, transcript)).toFrame();
      transcript = HandshakeContext.append(transcript, serverFinished.encode());
      HandshakeContext next = context
          .withKeys(clientHello.clientNonce(), serverNonce, keys, null)
          .advance(ConnectionState.AWAIT_FINISHED, transcript);
      return Step.of(next, serverHello, serverFinished);
    } finally {
      ByteUtils.wipe(macKey);
    }
  }

  private Encapsulation encapsulate(byte[] publicKey) {
    try {
      return kem.encapsulate(publicKey);
    } catch (KemTlsException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new KemTlsException(FailureKind.CRYPTO_ERROR, "Encapsulation failed", e);
    }
  }

  private Step onClientFinished(HandshakeContext context, Frame frame) {
    ClientFinished clientFinished = ClientFinished.parse(frame.payload());
    byte[] macKey = context.keys().macKey();
    try {
      byte[] expected = Hkdf.hmacSha256(macKey, context.transcript());
      if (!macMatches(expected, clientFinished.mac())) {
        return fail(context, FailureKind.AUTHENTICATION_FAILURE, "ClientFinished MAC mismatch");
      }
      return Step.of(context.advance(ConnectionState.ESTABLISHED,
          HandshakeContext.append(context.transcript(), frame.encode())));
    } finally {
      ByteUtils.wipe(macKey);
    }
  }
}
