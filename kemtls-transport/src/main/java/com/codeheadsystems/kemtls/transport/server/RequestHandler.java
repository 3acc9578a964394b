package com.codeheadsystems.kemtls.transport.server;

/**
 * Application callback for requests arriving on a server channel.
 */
@FunctionalInterface
public interface RequestHandler {

  /**
   * Handles one decrypted request. A thrown exception aborts only this connection.
   *
   * @param request the request bytes
   * @return the response bytes, sent back on the same channel
   */
  byte[] handle(byte[] request);
}
