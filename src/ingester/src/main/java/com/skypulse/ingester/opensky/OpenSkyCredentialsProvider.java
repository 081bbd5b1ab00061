package com.skypulse.ingester.opensky;

import com.skypulse.ingester.config.ConfigurationException;
import com.skypulse.ingester.config.OpenSkyProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;

/**
 * Read-only credential store.
 *
 * <p>Explicit properties (environment) win; SSM Parameter Store is used when only parameter names
 * are configured. Credentials are resolved once and then reused for the process lifetime.
 */
@Component
public class OpenSkyCredentialsProvider {
  private static final Logger log = LoggerFactory.getLogger(OpenSkyCredentialsProvider.class);

  private final OpenSkyProperties properties;
  private final ObjectProvider<SsmClient> ssmClient;
  private OpenSkyCredentials credentials;

  public OpenSkyCredentialsProvider(OpenSkyProperties properties, ObjectProvider<SsmClient> ssmClient) {
    this.properties = properties;
    this.ssmClient = ssmClient;
  }

  @PostConstruct
  public void verifyConfigured() {
    if (hasExplicitCredentials()) {
      log.info("OpenSky credentials configured from environment (clientId={})", properties.clientId());
      return;
    }
    if (hasSsmParameters()) {
      if (ssmClient.getIfAvailable() == null) {
        throw new ConfigurationException("OpenSky SSM parameter names are set but aws.region is not configured");
      }
      log.info("OpenSky credentials will be read from SSM parameter {}", properties.clientIdSsm());
      return;
    }
    throw new ConfigurationException(
        "OpenSky credentials are missing. Set OPENSKY_CLIENT_ID/OPENSKY_CLIENT_SECRET or SSM parameter names.");
  }

  public synchronized OpenSkyCredentials get() {
    if (credentials != null) {
      return credentials;
    }
    if (hasExplicitCredentials()) {
      credentials = new OpenSkyCredentials(properties.clientId(), properties.clientSecret());
      return credentials;
    }
    if (hasSsmParameters()) {
      credentials = new OpenSkyCredentials(
          getParameter(properties.clientIdSsm()), getParameter(properties.clientSecretSsm()));
      return credentials;
    }
    throw new ConfigurationException("OpenSky credentials are missing.");
  }

  private boolean hasExplicitCredentials() {
    return isPresent(properties.clientId()) && isPresent(properties.clientSecret());
  }

  private boolean hasSsmParameters() {
    return isPresent(properties.clientIdSsm()) && isPresent(properties.clientSecretSsm());
  }

  private boolean isPresent(String value) {
    return value != null && !value.isBlank();
  }

  private String getParameter(String name) {
    SsmClient client = ssmClient.getIfAvailable();
    if (client == null) {
      throw new ConfigurationException("SSM client is not configured (aws.region)");
    }
    try {
      return client.getParameter(
          GetParameterRequest.builder().name(name).withDecryption(true).build()).parameter().value();
    } catch (SdkException ex) {
      throw new OpenSkyAuthException("Unable to read SSM parameter " + name, true, ex);
    }
  }
}
