package com.codeheadsystems.kemtls.handshake;

import com.codeheadsystems.kemtls.certificate.Certificate;
import com.codeheadsystems.kemtls.codec.ClientFinished;
import com.codeheadsystems.kemtls.codec.ClientHello;
import com.codeheadsystems.kemtls.codec.Frame;
import com.codeheadsystems.kemtls.codec.ServerFinished;
import com.codeheadsystems.kemtls.codec.ServerHello;
import com.codeheadsystems.kemtls.common.ByteUtils;
import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import com.codeheadsystems.kemtls.common.RandomProvider;
import com.codeheadsystems.kemtls.crypto.AsymmetricKeyPair;
import com.codeheadsystems.kemtls.crypto.Hkdf;
import com.codeheadsystems.kemtls.crypto.KeyEncapsulation;
import com.codeheadsystems.kemtls.crypto.KeySchedule;
import com.codeheadsystems.kemtls.crypto.SessionKeys;
import com.codeheadsystems.kemtls.crypto.Signature;
import java.util.Optional;

/**
 * Client side of the KEMTLS handshake.
 * <pre>
 *   IDLE --start/ClientHello--> AWAIT_SERVER_HELLO
 *   AWAIT_SERVER_HELLO --ServerHello--> AWAIT_FINISHED
 *   AWAIT_FINISHED --ServerFinished/ClientFinished--> ESTABLISHED
 * </pre>
 */
public class ClientHandshake extends HandshakeEngine {

  private final KeyEncapsulation kem;
  private final Signature signature;
  private final RandomProvider randomProvider;
  private final KeySchedule keySchedule;
  private final Optional<String> expectedSubject;

  /**
   * Instantiates a new Client handshake.
   *
   * @param kem             the key encapsulation
   * @param signature       the signature scheme used to verify the server certificate
   * @param randomProvider  source of the client nonce
   * @param expectedSubject when present, the server certificate subject must equal it
   */
  public ClientHandshake(KeyEncapsulation kem, Signature signature, RandomProvider randomProvider,
                         Optional<String> expectedSubject) {
    super(Role.CLIENT);
    this.kem = kem;
    this.signature = signature;
    this.randomProvider = randomProvider;
    this.keySchedule = KeySchedule.forKem(kem);
    this.expectedSubject = expectedSubject;
  }

  @Override
  public Step start(HandshakeContext context) {
    if (context.state() != ConnectionState.IDLE) {
      return context.state() == ConnectionState.FAILED
          ? Step.failed(context, new HandshakeFailure(FailureKind.PROTOCOL_VIOLATION, "Handshake already failed"))
          : fail(context, FailureKind.PROTOCOL_VIOLATION, "Handshake already started");
    }
    try {
      AsymmetricKeyPair ephemeral = kem.generateKeyPair();
      byte[] clientNonce = randomProvider.randomBytes(ClientHello.NONCE_LENGTH);
      Frame clientHello = new ClientHello(ephemeral.publicKey(), clientNonce).toFrame();
      HandshakeContext next = context.withClientHello(ephemeral, clientNonce)
          .advance(ConnectionState.AWAIT_SERVER_HELLO, clientHello.encode());
      return Step.of(next, clientHello);
    } catch (KemTlsException e) {
      return fail(context, e.failureKind(), e.getMessage());
    } catch (RuntimeException e) {
      return fail(context, FailureKind.CRYPTO_ERROR, "Ephemeral key generation failed: " + e.getMessage());
    }
  }

  @Override
  protected Step dispatch(HandshakeContext context, Frame frame) {
    return switch (frame.type()) {
      case SERVER_HELLO -> context.state() == ConnectionState.AWAIT_SERVER_HELLO
          ? onServerHello(context, frame)
          : unexpected(context, frame);
      case SERVER_FINISHED -> context.state() == ConnectionState.AWAIT_FINISHED
          ? onServerFinished(context, frame)
          : unexpected(context, frame);
      case CLIENT_HELLO, CLIENT_FINISHED, RECORD, ALERT -> unexpected(context, frame);
    };
  }

  private Step onServerHello(HandshakeContext context, Frame frame) {
    ServerHello serverHello = ServerHello.parse(frame.payload(), kem.ciphertextLength());
    Certificate certificate = serverHello.certificate();
    if (!certificate.verify(signature)) {
      return fail(context, FailureKind.AUTHENTICATION_FAILURE, "Server certificate signature invalid");
    }
    if (expectedSubject.isPresent() && !expectedSubject.get().equals(certificate.subject())) {
      return fail(context, FailureKind.AUTHENTICATION_FAILURE,
          "Server certificate subject " + certificate.subject() + " is not " + expectedSubject.get());
    }
    byte[] sharedSecret = decapsulate(context.ephemeralKeys(), serverHello.ciphertext());
    SessionKeys keys;
    try {
      keys = keySchedule.derive(sharedSecret, context.clientNonce(), serverHello.serverNonce());
    } finally {
      ByteUtils.wipe(sharedSecret);
    }
    HandshakeContext next = context
        .withKeys(context.clientNonce(), serverHello.serverNonce(), keys, certificate)
        .advance(ConnectionState.AWAIT_FINISHED, HandshakeContext.append(context.transcript(), frame.encode()));
    return Step.of(next);
  }

  private byte[] decapsulate(AsymmetricKeyPair ephemeral, byte[] ciphertext) {
    try {
      return kem.decapsulate(ephemeral.privateKey(), ciphertext);
    } catch (KemTlsException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new KemTlsException(FailureKind.CRYPTO_ERROR, "Decapsulation failed", e);
    } finally {
      ephemeral.destroyPrivateKey();
    }
  }

  private Step onServerFinished(HandshakeContext context, Frame frame) {
    ServerFinished serverFinished = ServerFinished.parse(frame.payload());
    byte[] macKey = context.keys().macKey();
    try {
      byte[] expected = Hkdf.hmacSha256(macKey, context.transcript());
      if (!macMatches(expected, serverFinished.mac())) {
        return fail(context, FailureKind.AUTHENTICATION_FAILURE, "ServerFinished MAC mismatch");
      }
      byte[] transcript = HandshakeContext.append(context.transcript(), frame.encode());
      Frame clientFinished = new ClientFinished(Hkdf.hmacSha256(macKey, transcript)).toFrame();
      transcript = HandshakeContext.append(transcript, clientFinished.encode());
      return Step.of(context.advance(ConnectionState.ESTABLISHED, transcript), clientFinished);
    } finally {
      ByteUtils.wipe(macKey);
    }
  }
}
