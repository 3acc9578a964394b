package com.codeheadsystems.kemtls.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.kemtls.common.ByteUtils;
import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

class KeyScheduleTest {

  private static final byte[] SECRET = FakeKeyEncapsulation.filled(0xA0);
  private static final byte[] CLIENT_NONCE = FakeKeyEncapsulation.filled(0x01);
  private static final byte[] SERVER_NONCE = FakeKeyEncapsulation.filled(0x02);

  private final KeySchedule keySchedule = new KeySchedule(32);

  @Test
  void derive_isDeterministic() {
    SessionKeys first = keySchedule.derive(SECRET, CLIENT_NONCE, SERVER_NONCE);
    SessionKeys second = keySchedule.derive(SECRET, CLIENT_NONCE, SERVER_NONCE);
    assertThat(first).isEqualTo(second);
  }

  @Test
  void derive_knownAnswer() {
    SessionKeys keys = keySchedule.derive(SECRET, CLIENT_NONCE, SERVER_NONCE);

    assertThat(Hex.toHexString(keys.encKey()))
        .isEqualTo("bbfd608b1b35f9e056ad94226d383652716b92fb3ba7bb78bcecf1d86c3a51b9");
    assertThat(Hex.toHexString(keys.macKey()))
        .isEqualTo("bfecd4d1bd29bac0e310baf3d07ceb000c17366c12c4aec9aeef1f7eacf0bc26");
    assertThat(Hex.toHexString(keys.iv())).isEqualTo("082a04318836af258fa41d02d5b9a0e0");
  }

  @Test
  void derive_lengths() {
    SessionKeys keys = keySchedule.derive(SECRET, CLIENT_NONCE, SERVER_NONCE);
    assertThat(keys.encKey()).hasSize(32);
    assertThat(keys.macKey()).hasSize(32);
    assertThat(keys.iv()).hasSize(16);
  }

  @Test
  void derive_matchesExpandLabelOfExtract() {
    SessionKeys keys = keySchedule.derive(SECRET, CLIENT_NONCE, SERVER_NONCE);
    byte[] prk = Hkdf.extract(KeySchedule.SALT, SECRET);
    byte[] context = ByteUtils.concat(CLIENT_NONCE, SERVER_NONCE);
    assertThat(keys.encKey()).isEqualTo(Hkdf.expandLabel(prk, "enc", context, 32));
    assertThat(keys.macKey()).isEqualTo(Hkdf.expandLabel(prk, "mac", context, 32));
    assertThat(keys.iv()).isEqualTo(Hkdf.expandLabel(prk, "iv", context, 16));
  }

  @Test
  void derive_labelsGiveDistinctKeys() {
    SessionKeys keys = keySchedule.derive(SECRET, CLIENT_NONCE, SERVER_NONCE);
    assertThat(keys.encKey()).isNotEqualTo(keys.macKey());
    assertThat(ByteUtils.slice(keys.encKey(), 0, 16)).isNotEqualTo(keys.iv());
  }

  @Test
  void derive_nonceChangesKeys() {
    SessionKeys base = keySchedule.derive(SECRET, CLIENT_NONCE, SERVER_NONCE);
    assertThat(keySchedule.derive(SECRET, FakeKeyEncapsulation.filled(0x03), SERVER_NONCE)).isNotEqualTo(base);
    assertThat(keySchedule.derive(SECRET, CLIENT_NONCE, FakeKeyEncapsulation.filled(0x03))).isNotEqualTo(base);
    assertThat(keySchedule.derive(SERVER_NONCE, CLIENT_NONCE, SERVER_NONCE)).isNotEqualTo(base);
  }

  @Test
  void derive_leavesSecretUntouched() {
    byte[] secret = SECRET.clone();
    keySchedule.derive(secret, CLIENT_NONCE, SERVER_NONCE);
    assertThat(secret).isEqualTo(SECRET);
  }

  @Test
  void derive_wrongSecretLengthIsCryptoError() {
    assertThatThrownBy(() -> keySchedule.derive(new byte[31], CLIENT_NONCE, SERVER_NONCE))
        .isInstanceOf(KemTlsException.class)
        .extracting(e -> ((KemTlsException) e).failureKind())
        .isEqualTo(FailureKind.CRYPTO_ERROR);
  }

  @Test
  void sessionKeys_destroyAndRedaction() {
    SessionKeys keys = keySchedule.derive(SECRET, CLIENT_NONCE, SERVER_NONCE);
    assertThat(keys.toString()).isEqualTo("SessionKeys[<redacted>]");
    keys.destroy();
    assertThat(keys.encKey()).containsOnly(0);
    assertThat(keys.macKey()).containsOnly(0);
  }
}
