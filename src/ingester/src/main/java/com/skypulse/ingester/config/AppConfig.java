package com.skypulse.ingester.config;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ssm.SsmClient;

@Configuration
public class AppConfig {
  @Bean
  public HttpClient httpClient(OpenSkyProperties properties) {
    HttpClient.Builder builder = HttpClient.newBuilder();
    if (properties.connectTimeoutMs() > 0) {
      builder.connectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
    }
    return builder.build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // Only needed when credentials are read from SSM Parameter Store.
  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "aws", name = "region")
  public SsmClient ssmClient(AwsProperties awsProperties) {
    return SsmClient.builder().region(Region.of(awsProperties.region())).build();
  }
}
