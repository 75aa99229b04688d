/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.cloudfn.client;

/**
 * Connection settings of a {@link CloudFunctionsClient}.
 * <p>
 * Instances are built with {@link #builder()}, or from the environment with
 * {@link #fromEnvironment()}:
 * <pre>{@code
 * var config = CloudFunctionsConfig.builder()
 *   .endpoint("localhost:8085")
 *   .withoutSslValidation()
 *   .build();
 * }</pre>
 */
public final class CloudFunctionsConfig {

  /** Endpoint used when none is configured. */
  public static final String DEFAULT_ENDPOINT = "cloudfunctions.googleapis.com:443";
  /** Channel pool size used when none is configured. */
  public static final int DEFAULT_CHANNEL_POOL_SIZE = 50;

  static final String ENDPOINT_ENV = "CLOUD_FUNCTIONS_ENDPOINT";
  static final String CA_CERT_ENV = "CLOUD_FUNCTIONS_CA_CERT";

  private final String endpoint;
  private final boolean sslValidation;
  private final String caCertPem;
  private final int channelPoolSize;

  private CloudFunctionsConfig(Builder builder) {
    this.endpoint = builder.endpoint;
    this.sslValidation = builder.sslValidation;
    this.caCertPem = builder.caCertPem;
    this.channelPoolSize = builder.channelPoolSize;
  }

  /**
   * @return the gRPC target, as {@code host:port}
   */
  public String endpoint() {
    return endpoint;
  }

  /**
   * @return whether the connection uses TLS with certificate validation
   */
  public boolean sslValidation() {
    return sslValidation;
  }

  /**
   * @return the path of a PEM file holding extra trusted CA certificates, or {@code null}
   */
  public String caCertPem() {
    return caCertPem;
  }

  /**
   * @return the maximum number of gRPC channels opened by the client
   */
  public int channelPoolSize() {
    return channelPoolSize;
  }

  /**
   * @return a builder initialized with the defaults
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a configuration from the {@code CLOUD_FUNCTIONS_ENDPOINT} and
   * {@code CLOUD_FUNCTIONS_CA_CERT} environment variables. Unset or blank variables leave the
   * defaults in place.
   *
   * @return the configuration
   */
  public static CloudFunctionsConfig fromEnvironment() {
    var builder = builder();

    var endpoint = System.getenv(ENDPOINT_ENV);
    if (endpoint != null && !endpoint.isBlank()) builder.endpoint(endpoint.trim());

    var caCert = System.getenv(CA_CERT_ENV);
    if (caCert != null && !caCert.isBlank()) builder.withCaCert(caCert.trim());

    return builder.build();
  }

  @Override
  public String toString() {
    return "CloudFunctionsConfig{" +
      "endpoint='" + endpoint + '\'' +
      ", sslValidation=" + sslValidation +
      ", caCertPem='" + caCertPem + '\'' +
      ", channelPoolSize=" + channelPoolSize +
      '}';
  }

  /**
   * Fluent builder for {@link CloudFunctionsConfig}.
   */
  public static final class Builder {
    private String endpoint = DEFAULT_ENDPOINT;
    private boolean sslValidation = true;
    private String caCertPem;
    private int channelPoolSize = DEFAULT_CHANNEL_POOL_SIZE;

    private Builder() {
    }

    public Builder endpoint(String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    /**
     * Connects in plaintext, typically to a local emulator.
     */
    public Builder withoutSslValidation() {
      this.sslValidation = false;
      return this;
    }

    public Builder withCaCert(String caCertPath) {
      this.caCertPem = caCertPath;
      return this;
    }

    public Builder channelPoolSize(int channelPoolSize) {
      this.channelPoolSize = channelPoolSize;
      return this;
    }

    /**
     * @return the configuration
     * @throws IllegalArgumentException if the settings are inconsistent
     */
    public CloudFunctionsConfig build() {
      validate();
      return new CloudFunctionsConfig(this);
    }

    private void validate() {
      if (endpoint == null || endpoint.isBlank())
        throw new IllegalArgumentException("endpoint is required");

      if (channelPoolSize < 1)
        throw new IllegalArgumentException("channelPoolSize must be at least 1, got: " + channelPoolSize);

      if (!sslValidation && caCertPem != null)
        throw new IllegalArgumentException("A CA certificate cannot be used without SSL validation");
    }
  }
}
