package com.codeheadsystems.kemtls.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;

/**
 * A bidirectional byte stream carrying KEMTLS frames.
 */
public interface ByteStreamTransport extends AutoCloseable {

  /**
   * Input stream.
   *
   * @return the stream frames are read from
   * @throws IOException if the transport is unusable
   */
  InputStream inputStream() throws IOException;

  /**
   * Output stream. Callers flush after each flight.
   *
   * @return the stream frames are written to
   * @throws IOException if the transport is unusable
   */
  OutputStream outputStream() throws IOException;

  /**
   * Bounds every subsequent blocking read. Expiry surfaces as
   * {@link java.net.SocketTimeoutException}.
   *
   * @param timeout the timeout; zero means unbounded
   * @throws IOException if the timeout cannot be applied
   */
  void setReadTimeout(Duration timeout) throws IOException;

  /**
   * Peer description for logs.
   *
   * @return the description
   */
  String peer();

  /**
   * Closes the transport. Idempotent, never throws.
   */
  @Override
  void close();
}
