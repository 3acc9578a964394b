package com.codeheadsystems.kemtls.transport.config;

import com.codeheadsystems.kemtls.codec.WireCodec;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;

/**
 * Server-side KEMTLS configuration.
 * <p>
 * Every key is optional when bound from YAML; a missing key takes its default. The KEM and
 * signature names must match the client's exactly, as there is no algorithm negotiation.
 *
 * @param host               bind address (default {@code 0.0.0.0})
 * @param port               bind port; 0 picks a free port (default 8443)
 * @param subject            certificate subject (default {@code CN=PQ-OIDC-Server})
 * @param kemAlgorithm       {@code ML-KEM-512}, {@code ML-KEM-768} (default) or {@code ML-KEM-1024}
 * @param signatureAlgorithm {@code ML-DSA-44}, {@code ML-DSA-65} (default) or {@code ML-DSA-87}
 * @param timeoutMillis      bound on every read, handshake included (default 10000)
 * @param maxMessageSize     largest frame payload and application message (default 1 MiB)
 * @param workerThreads      connections served concurrently (default 8)
 */
public record KemTlsServerConfig(
    @JsonProperty("host") String host,
    @JsonProperty("port") Integer port,
    @JsonProperty("subject") String subject,
    @JsonProperty("kemAlgorithm") String kemAlgorithm,
    @JsonProperty("signatureAlgorithm") String signatureAlgorithm,
    @JsonProperty("timeoutMillis") Long timeoutMillis,
    @JsonProperty("maxMessageSize") Integer maxMessageSize,
    @JsonProperty("workerThreads") Integer workerThreads) {

  public static final String DEFAULT_HOST = "0.0.0.0";
  public static final int DEFAULT_PORT = 8443;
  public static final String DEFAULT_SUBJECT = "CN=PQ-OIDC-Server";
  public static final String DEFAULT_KEM = "ML-KEM-768";
  public static final String DEFAULT_SIGNATURE = "ML-DSA-65";
  public static final long DEFAULT_TIMEOUT_MILLIS = 10_000;
  /**
   * Socket timeouts are int milliseconds.
   */
  public static final long MAX_TIMEOUT_MILLIS = Integer.MAX_VALUE;
  public static final int DEFAULT_WORKER_THREADS = 8;

  public KemTlsServerConfig {
    host = host == null ? DEFAULT_HOST : host;
    port = port == null ? DEFAULT_PORT : port;
    subject = subject == null ? DEFAULT_SUBJECT : subject;
    kemAlgorithm = kemAlgorithm == null ? DEFAULT_KEM : kemAlgorithm;
    signatureAlgorithm = signatureAlgorithm == null ? DEFAULT_SIGNATURE : signatureAlgorithm;
    timeoutMillis = timeoutMillis == null ? DEFAULT_TIMEOUT_MILLIS : timeoutMillis;
    maxMessageSize = maxMessageSize == null ? WireCodec.DEFAULT_MAX_MESSAGE_SIZE : maxMessageSize;
    workerThreads = workerThreads == null ? DEFAULT_WORKER_THREADS : workerThreads;
    if (port < 0 || port > 0xFFFF) {
      throw new IllegalArgumentException("port out of range: " + port);
    }
    if (timeoutMillis <= 0 || timeoutMillis > MAX_TIMEOUT_MILLIS) {
      throw new IllegalArgumentException("timeoutMillis must be in 1.." + MAX_TIMEOUT_MILLIS + ": " + timeoutMillis);
    }
    if (maxMessageSize <= 0) {
      throw new IllegalArgumentException("maxMessageSize must be positive: " + maxMessageSize);
    }
    if (workerThreads <= 0) {
      throw new IllegalArgumentException("workerThreads must be positive: " + workerThreads);
    }
  }

  /**
   * All defaults.
   *
   * @return the config
   */
  public static KemTlsServerConfig defaults() {
    return new KemTlsServerConfig(null, null, null, null, null, null, null, null);
  }

  /**
   * Loopback on a free port with a short timeout and two workers. Do not use in production.
   *
   * @return the config
   */
  public static KemTlsServerConfig forTesting() {
    return new KemTlsServerConfig("127.0.0.1", 0, null, null, null, 2_000L, null, 2);
  }

  /**
   * Read timeout as a duration.
   *
   * @return the timeout
   */
  public Duration timeout() {
    return Duration.ofMillis(timeoutMillis);
  }

  /**
   * A codec bounded by {@link #maxMessageSize()}.
   *
   * @return the codec
   */
  public WireCodec wireCodec() {
    return new WireCodec(maxMessageSize);
  }
}
