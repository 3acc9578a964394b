package com.codeheadsystems.kemtls.handshake;

/**
 * Lifecycle of one connection. Transitions only move forward; FAILED is terminal.
 */
public enum ConnectionState {
  IDLE,
  AWAIT_SERVER_HELLO,
  AWAIT_FINISHED,
  ESTABLISHED,
  FAILED
}
