package com.codeheadsystems.kemtls.handshake;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.kemtls.certificate.Certificate;
import com.codeheadsystems.kemtls.codec.Alert;
import com.codeheadsystems.kemtls.codec.ClientFinished;
import com.codeheadsystems.kemtls.codec.Frame;
import com.codeheadsystems.kemtls.codec.MessageType;
import com.codeheadsystems.kemtls.codec.ServerHello;
import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.crypto.AsymmetricKeyPair;
import com.codeheadsystems.kemtls.crypto.FakeKeyEncapsulation;
import com.codeheadsystems.kemtls.crypto.SessionKeys;
import java.util.Optional;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

class HandshakeTest {

  @Test
  void fullHandshake_bothSidesDeriveIdenticalKeys() {
    HandshakeFixture fixture = new HandshakeFixture();
    fixture.runToCompletion();

    assertThat(fixture.clientContext.state()).isEqualTo(ConnectionState.ESTABLISHED);
    assertThat(fixture.serverContext.state()).isEqualTo(ConnectionState.ESTABLISHED);
    Session clientSession = fixture.clientContext.session().orElseThrow();
    Session serverSession = fixture.serverContext.session().orElseThrow();
    assertThat(clientSession.keys()).isEqualTo(serverSession.keys());
    assertThat(clientSession.peerCertificate()).contains(fixture.identity.certificate());
    assertThat(serverSession.peerCertificate()).isEmpty();
    assertThat(fixture.clientContext.transcript()).isEqualTo(fixture.serverContext.transcript());
  }

  // Expected frames and keys below were computed with an independent HKDF/HMAC-SHA256
  // implementation from the fake inputs: shared secret 0xa0.., client nonce 0x01.., server
  // nonce 0x02.., identity KEM key 0x1a.., signing key 0x70...
  private static final String CERTIFICATE_HEX = "0011434e3d50512d4f4944432d536572766572"
      + "0020" + "1a".repeat(32)
      + "0020" + "70".repeat(32)
      + "0020c232bdd2f3b553a70bbfea78c11e6835f7c0fdeb492de3e15940578df9c17765";
  private static final String SERVER_FINISHED_HEX =
      "0600000020770a948f3c7fbf7a9d2780310475b46f4bbeb00522918b585a94f64e81d63d62";
  private static final String CLIENT_FINISHED_HEX =
      "050000002085989c5adadf883d2f159f71ba43c287f88d16ac721252c368db6dbd13c912e1";
  private static final String ENC_KEY_HEX = "bbfd608b1b35f9e056ad94226d383652716b92fb3ba7bb78bcecf1d86c3a51b9";
  private static final String MAC_KEY_HEX = "bfecd4d1bd29bac0e310baf3d07ceb000c17366c12c4aec9aeef1f7eacf0bc26";
  private static final String IV_HEX = "082a04318836af258fa41d02d5b9a0e0";

  @Test
  void deterministicVectors() {
    HandshakeFixture fixture = new HandshakeFixture();
    assertThat(Hex.toHexString(fixture.identity.certificate().serialize())).isEqualTo(CERTIFICATE_HEX);

    // key pair 0: private 0x40.., public 0x40 ^ 0x5a = 0x1a..; client nonce from first random call
    Frame clientHello = fixture.clientStart();
    assertThat(Hex.toHexString(clientHello.encode()))
        .isEqualTo("01" + "00000040" + "1a".repeat(32) + "01".repeat(32));

    // encapsulation 0: secret 0xa0.., ciphertext 0xa0 ^ 0x1a = 0xba..
    Step serverFlight = fixture.toServer(clientHello);
    assertThat(serverFlight.outgoing()).hasSize(2);
    Frame serverHello = serverFlight.outgoing().get(0);
    assertThat(Hex.toHexString(serverHello.encode()))
        .isEqualTo("02000000b9" + "ba".repeat(32) + "02".repeat(32) + CERTIFICATE_HEX);

    Frame serverFinished = serverFlight.outgoing().get(1);
    assertThat(Hex.toHexString(serverFinished.encode())).isEqualTo(SERVER_FINISHED_HEX);

    assertThat(fixture.toClient(serverHello).outgoing()).isEmpty();
    Frame clientFinished = fixture.toClient(serverFinished).outgoing().get(0);
    assertThat(Hex.toHexString(clientFinished.encode())).isEqualTo(CLIENT_FINISHED_HEX);

    assertThat(fixture.toServer(clientFinished).outgoing()).isEmpty();
    for (HandshakeContext context : new HandshakeContext[]{fixture.clientContext, fixture.serverContext}) {
      SessionKeys keys = context.session().orElseThrow().keys();
      assertThat(Hex.toHexString(keys.encKey())).isEqualTo(ENC_KEY_HEX);
      assertThat(Hex.toHexString(keys.macKey())).isEqualTo(MAC_KEY_HEX);
      assertThat(Hex.toHexString(keys.iv())).isEqualTo(IV_HEX);
    }
    byte[] transcript = Hex.decode(Hex.toHexString(clientHello.encode()) + Hex.toHexString(serverHello.encode())
        + SERVER_FINISHED_HEX + CLIENT_FINISHED_HEX);
    assertThat(fixture.serverContext.transcript()).isEqualTo(transcript);
  }

  @Test
  void stateProgression() {
    HandshakeFixture fixture = new HandshakeFixture();
    assertThat(fixture.clientContext.state()).isEqualTo(ConnectionState.IDLE);
    Frame clientHello = fixture.clientStart();
    assertThat(fixture.clientContext.state()).isEqualTo(ConnectionState.AWAIT_SERVER_HELLO);
    assertThat(fixture.server.start(fixture.serverContext).outgoing()).isEmpty();
    Step serverFlight = fixture.toServer(clientHello);
    assertThat(fixture.serverContext.state()).isEqualTo(ConnectionState.AWAIT_FINISHED);
    fixture.toClient(serverFlight.outgoing().get(0));
    assertThat(fixture.clientContext.state()).isEqualTo(ConnectionState.AWAIT_FINISHED);
    assertThat(fixture.clientContext.session()).isEmpty();
    assertThat(fixture.serverContext.session()).isEmpty();
  }

  @Test
  void ephemeralPrivateKeyWipedAfterDecapsulation() {
    HandshakeFixture fixture = new HandshakeFixture();
    Frame clientHello = fixture.clientStart();
    AsymmetricKeyPair ephemeral = fixture.clientContext.ephemeralKeys();
    fixture.toClient(fixture.toServer(clientHello).outgoing().get(0));

    assertThat(ephemeral.privateKey()).containsOnly(0);
    assertThat(fixture.clientContext.ephemeralKeys()).isNull();
  }

  @Test
  void differentEphemeralKeysGiveDifferentSessionKeys() {
    FakeKeyEncapsulation kem = new FakeKeyEncapsulation();
    HandshakeFixture first = new HandshakeFixture(kem, Optional.empty());
    first.runToCompletion();
    HandshakeFixture second = new HandshakeFixture(kem, Optional.empty());
    second.runToCompletion();

    assertThat(first.clientContext.session().orElseThrow().keys())
        .isNotEqualTo(second.clientContext.session().orElseThrow().keys());
  }

  @Test
  void subjectPin_matchingSubjectEstablishes() {
    HandshakeFixture fixture = new HandshakeFixture(new FakeKeyEncapsulation(), Optional.of(HandshakeFixture.SUBJECT));
    fixture.runToCompletion();
    assertThat(fixture.clientContext.isEstablished()).isTrue();
  }

  @Test
  void subjectPin_otherSubjectIsAuthenticationFailure() {
    HandshakeFixture fixture = new HandshakeFixture(new FakeKeyEncapsulation(), Optional.of("CN=Elsewhere"));
    Step step = fixture.toClient(fixture.toServer(fixture.clientStart()).outgoing().get(0));
    assertThat(step.failure().map(HandshakeFailure::kind)).contains(FailureKind.AUTHENTICATION_FAILURE);
  }

  @Test
  void corruptedCertificateSignature_authenticationFailureWithoutKeys() {
    HandshakeFixture fixture = new HandshakeFixture();
    Frame serverHelloFrame = fixture.toServer(fixture.clientStart()).outgoing().get(0);
    ServerHello serverHello = ServerHello.parse(serverHelloFrame.payload(), FakeKeyEncapsulation.LENGTH);
    Certificate certificate = serverHello.certificate();
    byte[] signature = certificate.signature().clone();
    signature[signature.length - 1] ^= 0x01;
    Certificate forged = new Certificate(certificate.subject(), certificate.kemPublicKey(),
        certificate.sigPublicKey(), signature);

    Step step = fixture.toClient(new ServerHello(serverHello.ciphertext(), serverHello.serverNonce(), forged).toFrame());

    assertThat(step.failure().map(HandshakeFailure::kind)).contains(FailureKind.AUTHENTICATION_FAILURE);
    assertThat(step.context().state()).isEqualTo(ConnectionState.FAILED);
    assertThat(step.context().keys()).isNull();
    assertThat(step.context().session()).isEmpty();
  }

  @Test
  void malformedServerHello() {
    HandshakeFixture fixture = new HandshakeFixture();
    fixture.clientStart();
    Step step = fixture.toClient(new Frame(MessageType.SERVER_HELLO, new byte[40]));
    assertThat(step.failure().map(HandshakeFailure::kind)).contains(FailureKind.MALFORMED_MESSAGE);
  }

  @Test
  void wrongSharedSecretLength_cryptoError() {
    FakeKeyEncapsulation shortSecrets = new FakeKeyEncapsulation() {
      @Override
      public byte[] decapsulate(byte[] privateKey, byte[] ciphertext) {
        return new byte[31];
      }
    };
    HandshakeFixture fixture = new HandshakeFixture(shortSecrets, Optional.empty());
    Step step = fixture.toClient(fixture.toServer(fixture.clientStart()).outgoing().get(0));
    assertThat(step.failure().map(HandshakeFailure::kind)).contains(FailureKind.CRYPTO_ERROR);
  }

  @Test
  void decapsulationException_cryptoError() {
    FakeKeyEncapsulation broken = new FakeKeyEncapsulation() {
      @Override
      public byte[] decapsulate(byte[] privateKey, byte[] ciphertext) {
        throw new IllegalStateException("boom");
      }
    };
    HandshakeFixture fixture = new HandshakeFixture(broken, Optional.empty());
    Step step = fixture.toClient(fixture.toServer(fixture.clientStart()).outgoing().get(0));
    assertThat(step.failure().map(HandshakeFailure::kind)).contains(FailureKind.CRYPTO_ERROR);
  }

  @Test
  void serverRejectsBadClientHelloKey() {
    HandshakeFixture fixture = new HandshakeFixture();
    Step step = fixture.toServer(new Frame(MessageType.CLIENT_HELLO, new byte[33]));
    assertThat(step.failure().map(HandshakeFailure::kind)).contains(FailureKind.CRYPTO_ERROR);
  }

  @Test
  void alertDuringHandshake_connectionClosed() {
    HandshakeFixture fixture = new HandshakeFixture();
    fixture.clientStart();
    Step step = fixture.toClient(Alert.FAILURE.toFrame());
    assertThat(step.failure().map(HandshakeFailure::kind)).contains(FailureKind.CONNECTION_CLOSED);
    assertThat(step.context().state()).isEqualTo(ConnectionState.FAILED);
  }

  @Test
  void abort_forcesFailedAndWipesEphemeralKey() {
    HandshakeFixture fixture = new HandshakeFixture();
    fixture.clientStart();
    AsymmetricKeyPair ephemeral = fixture.clientContext.ephemeralKeys();

    HandshakeContext aborted = fixture.client.abort(fixture.clientContext);

    assertThat(aborted.state()).isEqualTo(ConnectionState.FAILED);
    assertThat(aborted.failureReason().map(HandshakeFailure::kind)).contains(FailureKind.CONNECTION_CLOSED);
    assertThat(ephemeral.privateKey()).containsOnly(0);
    assertThat(fixture.client.abort(aborted)).isSameAs(aborted);
  }

  @Test
  void establishedServerRejectsFurtherHandshakeMessages() {
    HandshakeFixture fixture = new HandshakeFixture();
    fixture.runToCompletion();
    Step step = fixture.toServer(new ClientFinished(new byte[32]).toFrame());
    assertThat(step.failure().map(HandshakeFailure::kind)).contains(FailureKind.PROTOCOL_VIOLATION);
  }

  @Test
  void strayFrameAfterEstablished_keepsSessionKeys() {
    HandshakeFixture fixture = new HandshakeFixture();
    fixture.runToCompletion();
    HandshakeContext established = fixture.serverContext;
    Session session = established.session().orElseThrow();
    byte[] encKey = session.keys().encKey();
    byte[] macKey = session.keys().macKey();

    Step step = fixture.server.step(established, new Frame(MessageType.RECORD, new byte[20]));
    Step alert = fixture.server.step(established, Alert.FAILURE.toFrame());

    assertThat(step.failure().map(HandshakeFailure::kind)).contains(FailureKind.PROTOCOL_VIOLATION);
    assertThat(alert.failure().map(HandshakeFailure::kind)).contains(FailureKind.PROTOCOL_VIOLATION);
    assertThat(step.context()).isSameAs(established);
    assertThat(established.isEstablished()).isTrue();
    assertThat(session.keys().encKey()).isEqualTo(encKey).isNotEqualTo(new byte[32]);
    assertThat(session.keys().macKey()).isEqualTo(macKey);
    assertThat(established.session().orElseThrow().keys())
        .isEqualTo(fixture.clientContext.session().orElseThrow().keys());
  }

  @Test
  void abortAfterEstablished_keepsSessionKeys() {
    HandshakeFixture fixture = new HandshakeFixture();
    fixture.runToCompletion();
    Session session = fixture.clientContext.session().orElseThrow();
    byte[] encKey = session.keys().encKey();

    HandshakeContext aborted = fixture.client.abort(fixture.clientContext);

    assertThat(aborted.state()).isEqualTo(ConnectionState.FAILED);
    assertThat(aborted.session()).isEmpty();
    assertThat(session.keys().encKey()).isEqualTo(encKey).isNotEqualTo(new byte[32]);
  }
}
