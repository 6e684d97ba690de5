package io.transcribehive.producer;

import java.net.URI;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

@Configuration
class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  S3Client s3Client(ObjectStoreProperties properties) {
    S3ClientBuilder builder = S3Client.builder()
        .region(Region.of(properties.getRegion()))
        .serviceConfiguration(s3Configuration(properties));
    if (!properties.getEndpoint().isEmpty()) {
      builder.endpointOverride(URI.create(properties.getEndpoint()));
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  S3Presigner s3Presigner(ObjectStoreProperties properties) {
    S3Presigner.Builder builder = S3Presigner.builder()
        .region(Region.of(properties.getRegion()))
        .serviceConfiguration(s3Configuration(properties));
    if (!properties.getEndpoint().isEmpty()) {
      builder.endpointOverride(URI.create(properties.getEndpoint()));
    }
    return builder.build();
  }

  private static S3Configuration s3Configuration(ObjectStoreProperties properties) {
    return S3Configuration.builder()
        .pathStyleAccessEnabled(properties.isPathStyle())
        .build();
  }
}
