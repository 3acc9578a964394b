package com.codeheadsystems.kemtls.handshake;

/**
 * Which end of the connection the local party is.
 */
public enum Role {
  CLIENT((byte) 0x01, (byte) 0x02),
  SERVER((byte) 0x02, (byte) 0x01);

  private final byte sendDirection;
  private final byte receiveDirection;

  Role(byte sendDirection, byte receiveDirection) {
    this.sendDirection = sendDirection;
    this.receiveDirection = receiveDirection;
  }

  /**
   * Direction byte mixed into nonces of records this role sends.
   * 0x01 is client-to-server, 0x02 is server-to-client.
   *
   * @return the direction byte
   */
  public byte sendDirection() {
    return sendDirection;
  }

  /**
   * Direction byte of records this role receives.
   *
   * @return the direction byte
   */
  public byte receiveDirection() {
    return receiveDirection;
  }
}
