package com.codeheadsystems.kemtls.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.kemtls.codec.Alert;
import com.codeheadsystems.kemtls.codec.Frame;
import com.codeheadsystems.kemtls.codec.MessageType;
import com.codeheadsystems.kemtls.codec.WireCodec;
import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import com.codeheadsystems.kemtls.common.RandomProvider;
import com.codeheadsystems.kemtls.crypto.MlDsaSignature;
import com.codeheadsystems.kemtls.crypto.MlKemKeyEncapsulation;
import com.codeheadsystems.kemtls.handshake.ClientHandshake;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HandshakeDriverTest {

  private static final Duration TIMEOUT = Duration.ofMillis(250);
  private static final String FAILURE_ALERT = "ff0000000128";

  @Mock private ByteStreamTransport transport;

  private final ByteArrayOutputStream written = new ByteArrayOutputStream();
  private HandshakeDriver driver;
  private ClientHandshake client;

  @BeforeEach
  void setUp() throws IOException {
    driver = new HandshakeDriver(WireCodec.DEFAULT, TIMEOUT);
    RandomProvider random = new RandomProvider();
    client = new ClientHandshake(MlKemKeyEncapsulation.fromName("ML-KEM-768", random),
        MlDsaSignature.fromName("ML-DSA-65", random), random, Optional.empty());
    when(transport.outputStream()).thenReturn(written);
  }

  @Test
  void endOfStreamBeforeServerHello() throws IOException {
    when(transport.inputStream()).thenReturn(new ByteArrayInputStream(new byte[0]));

    assertThatThrownBy(() -> driver.run(client, transport))
        .isInstanceOf(KemTlsException.class)
        .extracting(e -> ((KemTlsException) e).failureKind())
        .isEqualTo(FailureKind.CONNECTION_CLOSED);

    verify(transport).setReadTimeout(TIMEOUT);
    verify(transport).close();
    byte[] out = written.toByteArray();
    assertThat(out[0]).isEqualTo(MessageType.CLIENT_HELLO.tag());
    assertThat(HexFormat.of().formatHex(out)).endsWith(FAILURE_ALERT);
  }

  @Test
  void readTimeout() throws IOException {
    when(transport.inputStream()).thenReturn(new InputStream() {
      @Override
      public int read() throws IOException {
        throw new SocketTimeoutException("Read timed out");
      }
    });

    assertThatThrownBy(() -> driver.run(client, transport))
        .isInstanceOf(KemTlsException.class)
        .extracting(e -> ((KemTlsException) e).failureKind())
        .isEqualTo(FailureKind.TIMEOUT);
    verify(transport).close();
    assertThat(HexFormat.of().formatHex(written.toByteArray())).endsWith(FAILURE_ALERT);
  }

  @Test
  void peerAlertDuringHandshake() throws IOException {
    when(transport.inputStream()).thenReturn(new ByteArrayInputStream(Alert.FAILURE.toFrame().encode()));

    assertThatThrownBy(() -> driver.run(client, transport))
        .isInstanceOf(KemTlsException.class)
        .extracting(e -> ((KemTlsException) e).failureKind())
        .isEqualTo(FailureKind.CONNECTION_CLOSED);
    verify(transport).close();
  }

  @Test
  void outOfOrderMessage() throws IOException {
    byte[] finished = new Frame(MessageType.SERVER_FINISHED, new byte[32]).encode();
    when(transport.inputStream()).thenReturn(new ByteArrayInputStream(finished));

    assertThatThrownBy(() -> driver.run(client, transport))
        .isInstanceOf(KemTlsException.class)
        .extracting(e -> ((KemTlsException) e).failureKind())
        .isEqualTo(FailureKind.PROTOCOL_VIOLATION);
    assertThat(HexFormat.of().formatHex(written.toByteArray())).endsWith(FAILURE_ALERT);
  }

  @Test
  void oversizedDeclaredLength() throws IOException {
    byte[] header = HexFormat.of().parseHex("027fffffff");
    when(transport.inputStream()).thenReturn(new ByteArrayInputStream(header));

    assertThatThrownBy(() -> driver.run(client, transport))
        .isInstanceOf(KemTlsException.class)
        .extracting(e -> ((KemTlsException) e).failureKind())
        .isEqualTo(FailureKind.MALFORMED_MESSAGE);
  }

  @Test
  void truncatedServerHelloSendsGenericAlert() throws IOException {
    byte[] garbage = new byte[40];
    Arrays.fill(garbage, (byte) 0x33);
    byte[] serverHello = new Frame(MessageType.SERVER_HELLO, garbage).encode();
    when(transport.inputStream()).thenReturn(new ByteArrayInputStream(serverHello));

    assertThatThrownBy(() -> driver.run(client, transport))
        .isInstanceOf(KemTlsException.class)
        .extracting(e -> ((KemTlsException) e).failureKind())
        .isEqualTo(FailureKind.MALFORMED_MESSAGE);
    assertThat(HexFormat.of().formatHex(written.toByteArray())).endsWith(FAILURE_ALERT);
  }
}
