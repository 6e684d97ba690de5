package io.transcribehive.transcriber;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

class ApplicationYamlTest {

  @Test
  void actuatorEndpointsAreReachableWithoutAWebServer() throws IOException {
    List<PropertySource<?>> sources =
        new YamlPropertySourceLoader().load("application", new ClassPathResource("application.yml"));
    PropertySource<?> yaml = sources.get(0);

    assertThat(String.valueOf(yaml.getProperty("spring.main.web-application-type"))).isEqualTo("none");
    assertThat(yaml.getProperty("management.endpoints.web.exposure.include")).isNull();
    assertThat(String.valueOf(yaml.getProperty("spring.jmx.enabled"))).isEqualTo("true");
    assertThat(String.valueOf(yaml.getProperty("management.endpoints.jmx.exposure.include")))
        .contains("health").contains("metrics");
  }
}
