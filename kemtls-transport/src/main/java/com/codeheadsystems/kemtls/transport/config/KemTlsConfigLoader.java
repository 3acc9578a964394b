package com.codeheadsystems.kemtls.transport.config;

import com.codeheadsystems.kemtls.transport.exceptions.KemTlsConfigException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds {@link KemTlsServerConfig} and {@link KemTlsClientConfig} from YAML.
 * Unknown keys are rejected so that a misspelt option does not silently fall back to a default.
 */
@Singleton
public class KemTlsConfigLoader {

  private static final Logger log = LoggerFactory.getLogger(KemTlsConfigLoader.class);

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new loader with a YAML object mapper.
   */
  @Inject
  public KemTlsConfigLoader() {
    this(new ObjectMapper(new YAMLFactory()));
  }

  /**
   * Instantiates a new loader.
   *
   * @param objectMapper a mapper able to read the source format
   */
  public KemTlsConfigLoader(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Load server config.
   *
   * @param path the YAML file
   * @return the config
   */
  public KemTlsServerConfig loadServerConfig(final Path path) {
    return read(path, KemTlsServerConfig.class);
  }

  /**
   * Load server config.
   *
   * @param in YAML content
   * @return the config
   */
  public KemTlsServerConfig loadServerConfig(final InputStream in) {
    return read(in, "stream", KemTlsServerConfig.class);
  }

  /**
   * Load client config.
   *
   * @param path the YAML file
   * @return the config
   */
  public KemTlsClientConfig loadClientConfig(final Path path) {
    return read(path, KemTlsClientConfig.class);
  }

  /**
   * Load client config.
   *
   * @param in YAML content
   * @return the config
   */
  public KemTlsClientConfig loadClientConfig(final InputStream in) {
    return read(in, "stream", KemTlsClientConfig.class);
  }

  private <T> T read(final Path path, final Class<T> type) {
    try (InputStream in = Files.newInputStream(path)) {
      return read(in, path.toString(), type);
    } catch (IOException e) {
      throw new KemTlsConfigException("Unable to read configuration: " + path, e);
    }
  }

  private <T> T read(final InputStream in, final String source, final Class<T> type) {
    log.debug("read(source={}, type={})", source, type.getSimpleName());
    try {
      T config = objectMapper.readValue(in, type);
      if (config == null) {
        throw new KemTlsConfigException("Empty configuration: " + source, null);
      }
      return config;
    } catch (IOException | IllegalArgumentException e) {
      throw new KemTlsConfigException("Invalid configuration in " + source + ": " + e.getMessage(), e);
    }
  }
}
