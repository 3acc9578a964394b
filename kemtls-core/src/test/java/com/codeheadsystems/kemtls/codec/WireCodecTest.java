package com.codeheadsystems.kemtls.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.InputStream;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

class WireCodecTest {

  private final WireCodec codec = new WireCodec(64);

  @Test
  void encode_exactHeaderBytes() {
    byte[] encoded = WireCodec.DEFAULT.encode(MessageType.SERVER_FINISHED, Hex.decode("aabbcc"));
    assertThat(Hex.toHexString(encoded)).isEqualTo("0600000003aabbcc");
  }

  @Test
  void encode_emptyPayload() {
    assertThat(Hex.toHexString(WireCodec.DEFAULT.encode(MessageType.RECORD, new byte[0]))).isEqualTo("1000000000");
  }

  @Test
  void encode_rejectsOversizedPayload() {
    assertThatThrownBy(() -> codec.encode(MessageType.RECORD, new byte[65]))
        .isInstanceOf(KemTlsException.class)
        .extracting(e -> ((KemTlsException) e).failureKind())
        .isEqualTo(FailureKind.MALFORMED_MESSAGE);
  }

  @Test
  void decode_returnsFrameAndConsumedLength() {
    byte[] bytes = Hex.decode("ff0000000128" + "0102");
    WireCodec.DecodedFrame decoded = codec.decode(bytes);
    assertThat(decoded.frame()).isEqualTo(new Frame(MessageType.ALERT, new byte[]{0x28}));
    assertThat(decoded.bytesConsumed()).isEqualTo(6);
  }

  @Test
  void decode_reencodesToSameBytes() {
    byte[] bytes = Hex.decode("0100000004deadbeef");
    assertThat(codec.decode(bytes).frame().encode()).isEqualTo(bytes);
  }

  @Test
  void decode_truncatedHeader() {
    assertMalformed(() -> codec.decode(Hex.decode("01000000")));
  }

  @Test
  void decode_lengthBeyondAvailable() {
    assertMalformed(() -> codec.decode(Hex.decode("0100000005aabbccdd")));
  }

  @Test
  void decode_lengthBeyondMaximum() {
    assertMalformed(() -> codec.decode(Hex.decode("0100000041")));
    assertMalformed(() -> codec.decode(Hex.decode("01ffffffff")));
  }

  @Test
  void decode_unknownType() {
    assertMalformed(() -> codec.decode(Hex.decode("0300000000")));
  }

  @Test
  void readFrame_readsConsecutiveFrames() throws Exception {
    InputStream in = new ByteArrayInputStream(Hex.decode("0500000001aa" + "1000000000"));
    assertThat(codec.readFrame(in)).isEqualTo(new Frame(MessageType.CLIENT_FINISHED, new byte[]{(byte) 0xaa}));
    assertThat(codec.readFrame(in)).isEqualTo(new Frame(MessageType.RECORD, new byte[0]));
  }

  @Test
  void readFrame_eofInsideHeader() {
    assertThatThrownBy(() -> codec.readFrame(new ByteArrayInputStream(Hex.decode("0500"))))
        .isInstanceOf(EOFException.class);
  }

  @Test
  void readFrame_eofInsidePayload() {
    assertThatThrownBy(() -> codec.readFrame(new ByteArrayInputStream(Hex.decode("0500000004aabb"))))
        .isInstanceOf(EOFException.class);
  }

  @Test
  void readFrame_oversizedLengthRejectedBeforeReadingPayload() {
    assertMalformed(() -> codec.readFrame(new ByteArrayInputStream(Hex.decode("107fffffff"))));
  }

  private static void assertMalformed(org.assertj.core.api.ThrowableAssert.ThrowingCallable call) {
    assertThatThrownBy(call)
        .isInstanceOf(KemTlsException.class)
        .extracting(e -> ((KemTlsException) e).failureKind())
        .isEqualTo(FailureKind.MALFORMED_MESSAGE);
  }
}
