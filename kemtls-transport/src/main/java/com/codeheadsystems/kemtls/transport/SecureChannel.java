package com.codeheadsystems.kemtls.transport;

import com.codeheadsystems.kemtls.certificate.Certificate;
import com.codeheadsystems.kemtls.codec.Alert;
import com.codeheadsystems.kemtls.codec.Frame;
import com.codeheadsystems.kemtls.codec.HandshakeMessage;
import com.codeheadsystems.kemtls.codec.MessageType;
import com.codeheadsystems.kemtls.codec.RecordMessage;
import com.codeheadsystems.kemtls.codec.WireCodec;
import com.codeheadsystems.kemtls.common.ByteUtils;
import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import com.codeheadsystems.kemtls.handshake.Session;
import com.codeheadsystems.kemtls.record.RecordProtection;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.SocketTimeoutException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An established KEMTLS connection carrying encrypted application messages.
 * <p>
 * A message is split into records of at most {@value #MAX_FRAGMENT} plaintext bytes. Each record
 * plaintext is {@code flag || chunk} where the flag is 0x01 on the final fragment and 0x00
 * otherwise. The receiver reassembles up to the configured maximum message size.
 * <p>
 * Any failure moves the channel to FAILED, sends a generic alert, closes the transport and
 * throws; a FAILED or CLOSED channel refuses further use. Sending and receiving may happen on
 * different threads. Alerts are written under the send lock so they never split a record.
 */
public class SecureChannel implements AutoCloseable {

  /**
   * Largest plaintext chunk per record.
   */
  public static final int MAX_FRAGMENT = 16 * 1024;

  private static final Logger log = LoggerFactory.getLogger(SecureChannel.class);

  private static final byte FINAL_FRAGMENT = 0x01;
  private static final byte MORE_FRAGMENTS = 0x00;

  /**
   * Channel lifecycle.
   */
  public enum State {
    OPEN, CLOSED, FAILED
  }

  private final ByteStreamTransport transport;
  private final Session session;
  private final RecordProtection protection;
  private final WireCodec codec;
  private final int fragmentSize;
  private final Object sendLock = new Object();
  private final Object receiveLock = new Object();
  private volatile State state = State.OPEN;

  /**
   * Instantiates a new Secure channel over an already established session.
   *
   * @param transport the transport the handshake ran on
   * @param session   the session
   * @param codec     frame codec; its maximum also bounds reassembled messages
   */
  public SecureChannel(final ByteStreamTransport transport, final Session session, final WireCodec codec) {
    this.transport = transport;
    this.session = session;
    this.protection = RecordProtection.forSession(session);
    this.codec = codec;
    this.fragmentSize = Math.min(MAX_FRAGMENT, codec.maxMessageSize() - 1 - RecordProtection.TAG_LENGTH);
    if (fragmentSize <= 0) {
      throw new IllegalArgumentException("Maximum message size too small for records: " + codec.maxMessageSize());
    }
  }

  /**
   * Sends one message.
   *
   * @param message the message, possibly empty
   * @throws KemTlsException          on failure; the channel is FAILED afterwards
   * @throws IllegalArgumentException if the message exceeds the maximum message size
   */
  public void send(final byte[] message) {
    if (message.length > codec.maxMessageSize()) {
      throw new IllegalArgumentException("Message of " + message.length + " bytes exceeds maximum "
          + codec.maxMessageSize());
    }
    synchronized (sendLock) {
      checkOpen();
      try {
        OutputStream out = transport.outputStream();
        int offset = 0;
        do {
          int chunk = Math.min(fragmentSize, message.length - offset);
          byte flag = offset + chunk == message.length ? FINAL_FRAGMENT : MORE_FRAGMENTS;
          byte[] plaintext = ByteUtils.concat(new byte[]{flag}, ByteUtils.slice(message, offset, chunk));
          Frame record = new RecordMessage(protection.seal(plaintext)).toFrame();
          out.write(codec.encode(record.type(), record.payload()));
          offset += chunk;
        } while (offset < message.length);
        out.flush();
        log.debug("send({} bytes) to {}", message.length, transport.peer());
      } catch (KemTlsException e) {
        throw fail(e.failureKind(), e.getMessage(), e, true);
      } catch (IOException e) {
        throw fail(FailureKind.CONNECTION_CLOSED, "Send failed: " + e.getMessage(), e, false);
      }
    }
  }

  /**
   * Receives one complete message.
   *
   * @return the message
   * @throws KemTlsException on failure, including CONNECTION_CLOSED when the peer closes the channel
   */
  public byte[] receive() {
    synchronized (receiveLock) {
      checkOpen();
      try {
        ByteArrayOutputStream message = new ByteArrayOutputStream();
        while (true) {
          HandshakeMessage received = readChannelMessage();
          if (received instanceof Alert alert) {
            throw onAlert(alert);
          }
          byte[] plaintext = protection.open(((RecordMessage) received).ciphertext());
          if (plaintext.length == 0 || (plaintext[0] != FINAL_FRAGMENT && plaintext[0] != MORE_FRAGMENTS)) {
            throw new KemTlsException(FailureKind.MALFORMED_MESSAGE, "Record is missing a valid fragment flag");
          }
          if (message.size() + plaintext.length - 1 > codec.maxMessageSize()) {
            throw new KemTlsException(FailureKind.MALFORMED_MESSAGE,
                "Reassembled message exceeds maximum " + codec.maxMessageSize());
          }
          message.write(plaintext, 1, plaintext.length - 1);
          if (plaintext[0] == FINAL_FRAGMENT) {
            log.debug("receive() {} bytes from {}", message.size(), transport.peer());
            return message.toByteArray();
          }
        }
      } catch (KemTlsException e) {
        if (state != State.OPEN) {
          throw e;
        }
        throw fail(e.failureKind(), e.getMessage(), e, true);
      } catch (SocketTimeoutException e) {
        throw fail(FailureKind.TIMEOUT, "Receive timed out", e, true);
      } catch (IOException e) {
        if (state != State.OPEN) {
          throw new KemTlsException(FailureKind.CONNECTION_CLOSED, "Channel is " + state, e);
        }
        throw fail(FailureKind.CONNECTION_CLOSED, "Receive failed: " + e.getMessage(), e, false);
      }
    }
  }

  /**
   * Sends a request and waits for the reply.
   *
   * @param message the request
   * @return the reply
   */
  public byte[] request(final byte[] message) {
    send(message);
    return receive();
  }

  /**
   * Sends close-notify and closes the transport. Idempotent.
   */
  @Override
  public void close() {
    if (state != State.OPEN) {
      return;
    }
    state = State.CLOSED;
    writeAlert(Alert.CLOSE_NOTIFY);
    transport.close();
    log.debug("close() {}", transport.peer());
  }

  /**
   * Tears the channel down with a generic failure alert, e.g. after a local processing error.
   */
  public void abort() {
    if (state != State.OPEN) {
      return;
    }
    state = State.FAILED;
    writeAlert(Alert.FAILURE);
    transport.close();
  }

  /**
   * The session.
   *
   * @return the session
   */
  public Session session() {
    return session;
  }

  /**
   * Server certificate as verified by the client handshake; empty on the server side.
   *
   * @return the certificate
   */
  public Optional<Certificate> peerCertificate() {
    return session.peerCertificate();
  }

  /**
   * Current state.
   *
   * @return the state
   */
  public State state() {
    return state;
  }

  /**
   * Is open.
   *
   * @return true until closed or failed
   */
  public boolean isOpen() {
    return state == State.OPEN;
  }

  /**
   * Reads the next frame; only records and alerts are valid once the handshake is over.
   */
  private HandshakeMessage readChannelMessage() throws IOException {
    Frame frame = codec.readFrame(transport.inputStream());
    if (frame.type() != MessageType.RECORD && frame.type() != MessageType.ALERT) {
      throw new KemTlsException(FailureKind.PROTOCOL_VIOLATION, "Unexpected " + frame.type() + " on channel");
    }
    return HandshakeMessage.parse(frame, 0);
  }

  private void writeAlert(final Alert alert) {
    synchronized (sendLock) {
      HandshakeDriver.sendAlert(transport, alert);
    }
  }

  private KemTlsException onAlert(final Alert alert) {
    state = alert.isCloseNotify() ? State.CLOSED : State.FAILED;
    transport.close();
    log.debug("Peer {} sent {}", transport.peer(), alert.isCloseNotify() ? "close-notify" : "failure alert");
    return new KemTlsException(FailureKind.CONNECTION_CLOSED,
        alert.isCloseNotify() ? "Peer closed the channel" : "Peer sent an alert");
  }

  private void checkOpen() {
    if (state != State.OPEN) {
      throw new KemTlsException(FailureKind.CONNECTION_CLOSED, "Channel is " + state);
    }
  }

  private KemTlsException fail(final FailureKind kind, final String message, final Exception cause,
                               final boolean notifyPeer) {
    state = State.FAILED;
    log.warn("Channel with {} failed: {}", transport.peer(), kind);
    log.debug("Channel failure detail: {}", message);
    if (notifyPeer) {
      writeAlert(Alert.FAILURE);
    }
    transport.close();
    return new KemTlsException(kind, message, cause);
  }
}
