package com.codeheadsystems.kemtls.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

class ByteUtilsTest {

  @Test
  void i2osp_bigEndian() {
    assertThat(Hex.toHexString(ByteUtils.I2OSP(0x0102, 2))).isEqualTo("0102");
    assertThat(Hex.toHexString(ByteUtils.I2OSP(5, 4))).isEqualTo("00000005");
  }

  @Test
  void i2osp_rejectsOverflow() {
    assertThatThrownBy(() -> ByteUtils.I2OSP(256, 1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ByteUtils.I2OSP(-1, 4)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void longToBytes_unsignedMaximum() {
    assertThat(Hex.toHexString(ByteUtils.longToBytes(-1L))).isEqualTo("ffffffffffffffff");
    assertThat(Hex.toHexString(ByteUtils.longToBytes(1L))).isEqualTo("0000000000000001");
  }

  @Test
  void os2ip_readsFourByteLengthAboveIntMax() {
    assertThat(ByteUtils.OS2IP(Hex.decode("ffffffff"), 0, 4)).isEqualTo(0xFFFFFFFFL);
  }

  @Test
  void encodeVector_prefixesLength() {
    assertThat(Hex.toHexString(ByteUtils.encodeVector(Hex.decode("aabb")))).isEqualTo("0002aabb");
  }

  @Test
  void wipe_zeroesAndToleratesNull() {
    byte[] secret = Hex.decode("0102");
    ByteUtils.wipe(secret);
    ByteUtils.wipe(null);
    assertThat(secret).containsOnly(0);
  }
}
