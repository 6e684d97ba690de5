package io.transcribehive.callback;

import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class CallbackConfiguration {

  @Bean(destroyMethod = "close")
  CloseableHttpClient actionHttpClient() {
    return HttpClients.custom().useSystemProperties().build();
  }
}
