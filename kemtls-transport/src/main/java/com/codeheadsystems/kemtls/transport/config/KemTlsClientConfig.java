package com.codeheadsystems.kemtls.transport.config;

import com.codeheadsystems.kemtls.codec.WireCodec;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.Optional;

/**
 * Client-side KEMTLS configuration. Missing YAML keys take the same defaults as
 * {@link KemTlsServerConfig}.
 *
 * @param host               server host (default {@code localhost})
 * @param port               server port (default 8443)
 * @param kemAlgorithm       must match the server
 * @param signatureAlgorithm must match the server
 * @param timeoutMillis      connect and read bound (default 10000)
 * @param maxMessageSize     largest frame payload and application message (default 1 MiB)
 * @param expectedSubject    when set, the server certificate subject must equal it
 */
public record KemTlsClientConfig(
    @JsonProperty("host") String host,
    @JsonProperty("port") Integer port,
    @JsonProperty("kemAlgorithm") String kemAlgorithm,
    @JsonProperty("signatureAlgorithm") String signatureAlgorithm,
    @JsonProperty("timeoutMillis") Long timeoutMillis,
    @JsonProperty("maxMessageSize") Integer maxMessageSize,
    @JsonProperty("expectedSubject") String expectedSubject) {

  public static final String DEFAULT_HOST = "localhost";

  public KemTlsClientConfig {
    host = host == null ? DEFAULT_HOST : host;
    port = port == null ? KemTlsServerConfig.DEFAULT_PORT : port;
    kemAlgorithm = kemAlgorithm == null ? KemTlsServerConfig.DEFAULT_KEM : kemAlgorithm;
    signatureAlgorithm = signatureAlgorithm == null ? KemTlsServerConfig.DEFAULT_SIGNATURE : signatureAlgorithm;
    timeoutMillis = timeoutMillis == null ? KemTlsServerConfig.DEFAULT_TIMEOUT_MILLIS : timeoutMillis;
    maxMessageSize = maxMessageSize == null ? WireCodec.DEFAULT_MAX_MESSAGE_SIZE : maxMessageSize;
    if (port < 0 || port > 0xFFFF) {
      throw new IllegalArgumentException("port out of range: " + port);
    }
    if (timeoutMillis <= 0 || timeoutMillis > KemTlsServerConfig.MAX_TIMEOUT_MILLIS) {
      throw new IllegalArgumentException("timeoutMillis must be in 1.." + KemTlsServerConfig.MAX_TIMEOUT_MILLIS
          + ": " + timeoutMillis);
    }
    if (maxMessageSize <= 0) {
      throw new IllegalArgumentException("maxMessageSize must be positive: " + maxMessageSize);
    }
  }

  /**
   * All defaults.
   *
   * @return the config
   */
  public static KemTlsClientConfig defaults() {
    return new KemTlsClientConfig(null, null, null, null, null, null, null);
  }

  /**
   * Loopback client for the given port with a short timeout. Do not use in production.
   *
   * @param port the server port
   * @return the config
   */
  public static KemTlsClientConfig forTesting(int port) {
    return new KemTlsClientConfig("127.0.0.1", port, null, null, 2_000L, null, null);
  }

  /**
   * Copy with a pinned server subject.
   *
   * @param subject the subject
   * @return the config
   */
  public KemTlsClientConfig withExpectedSubject(String subject) {
    return new KemTlsClientConfig(host, port, kemAlgorithm, signatureAlgorithm, timeoutMillis, maxMessageSize,
        subject);
  }

  /**
   * Pinned subject.
   *
   * @return the subject, if configured
   */
  public Optional<String> pinnedSubject() {
    return Optional.ofNullable(expectedSubject);
  }

  public Duration timeout() {
    return Duration.ofMillis(timeoutMillis);
  }

  public WireCodec wireCodec() {
    return new WireCodec(maxMessageSize);
  }
}
