package com.codeheadsystems.kemtls.transport;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ByteStreamTransport} over a connected {@link Socket}.
 */
public class SocketTransport implements ByteStreamTransport {

  private static final Logger log = LoggerFactory.getLogger(SocketTransport.class);

  private final Socket socket;
  private final InputStream in;
  private final OutputStream out;

  /**
   * Instantiates a new Socket transport.
   *
   * @param socket a connected socket; owned by this transport from now on
   * @throws IOException if the socket streams are unavailable
   */
  public SocketTransport(final Socket socket) throws IOException {
    this.socket = socket;
    socket.setTcpNoDelay(true);
    this.in = new BufferedInputStream(socket.getInputStream());
    this.out = new BufferedOutputStream(socket.getOutputStream());
  }

  @Override
  public InputStream inputStream() {
    return in;
  }

  @Override
  public OutputStream outputStream() {
    return out;
  }

  @Override
  public void setReadTimeout(final Duration timeout) throws IOException {
    socket.setSoTimeout((int) Math.min(timeout.toMillis(), Integer.MAX_VALUE));
  }

  @Override
  public String peer() {
    return String.valueOf(socket.getRemoteSocketAddress());
  }

  @Override
  public void close() {
    try {
      socket.close();
    } catch (IOException e) {
      log.debug("close({}) failed: {}", peer(), e.getMessage());
    }
  }
}
