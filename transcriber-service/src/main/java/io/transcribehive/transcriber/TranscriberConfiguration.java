package io.transcribehive.transcriber;

import io.micrometer.core.instrument.MeterRegistry;
import io.transcribehive.queue.BrokerProperties;
import io.transcribehive.queue.RabbitQueueClientFactory;
import io.transcribehive.transcriber.asr.HttpTranscriptionInvoker;
import io.transcribehive.transcriber.asr.MeteredTranscriptionInvoker;
import io.transcribehive.transcriber.asr.ProcessTranscriptionInvoker;
import io.transcribehive.transcriber.asr.RetryingTranscriptionInvoker;
import io.transcribehive.transcriber.asr.TranscriptionInvoker;
import io.transcribehive.transcriber.delivery.HttpResultDelivery;
import io.transcribehive.transcriber.delivery.ResultDelivery;
import io.transcribehive.transcriber.delivery.RetryingResultDelivery;
import io.transcribehive.transcriber.usage.HttpUsageReporter;
import io.transcribehive.transcriber.usage.LoggingUsageReporter;
import io.transcribehive.transcriber.usage.UsageReporter;
import io.transcribehive.transcriber.worker.WorkerLoop;
import io.transcribehive.transcriber.worker.WorkerLoopRunner;
import io.transcribehive.transcriber.worker.WorkerMetrics;
import io.transcribehive.transcriber.worker.WorkerSettings;
import io.transcribehive.util.InstanceNameGenerator;
import java.net.URI;
import java.time.Clock;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(BrokerProperties.class)
public class TranscriberConfiguration {

  private static final Logger log = LoggerFactory.getLogger(TranscriberConfiguration.class);

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(destroyMethod = "close")
  CloseableHttpClient transcriberHttpClient(TranscriberProperties properties) {
    int loops = properties.getWorker().getConsumers();
    PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
        .setMaxConnTotal(Math.max(20, loops * 3))
        .setMaxConnPerRoute(Math.max(10, loops * 2))
        .setDefaultConnectionConfig(ConnectionConfig.custom()
            .setConnectTimeout(Timeout.ofSeconds(10))
            .build())
        .build();
    return HttpClients.custom()
        .setConnectionManager(connectionManager)
        .disableAutomaticRetries()
        .build();
  }

  @Bean
  UsageReporter usageReporter(TranscriberProperties properties, CloseableHttpClient transcriberHttpClient) {
    TranscriberProperties.Usage usage = properties.getUsage();
    if (usage.getUrl().isEmpty()) {
      log.info("No usage collector configured; usage events are logged only");
      return new LoggingUsageReporter();
    }
    return new HttpUsageReporter(transcriberHttpClient, HttpUsageReporter.endpointOf(usage.getUrl()),
        usage.getTimeout());
  }

  @Bean
  TranscriptionInvoker transcriptionInvoker(TranscriberProperties properties,
                                            CloseableHttpClient transcriberHttpClient,
                                            UsageReporter usageReporter,
                                            Clock clock) {
    TranscriberProperties.Asr asr = properties.getAsr();
    TranscriptionInvoker engine = switch (asr.getEngine()) {
      case HTTP -> new HttpTranscriptionInvoker(transcriberHttpClient, URI.create(asr.getUrl()), asr.getLanguage(),
          asr.getTimeout(), clock);
      case PROCESS -> new ProcessTranscriptionInvoker(asr.getCommand(), asr.getWorkDir(), asr.getLanguage(),
          asr.getTimeout(), clock);
    };
    return new RetryingTranscriptionInvoker(new MeteredTranscriptionInvoker(engine, usageReporter, clock),
        asr.getRetry().toPolicy());
  }

  @Bean
  ResultDelivery resultDelivery(TranscriberProperties properties, CloseableHttpClient transcriberHttpClient) {
    TranscriberProperties.Sink sink = properties.getSink();
    return new RetryingResultDelivery(
        new HttpResultDelivery(transcriberHttpClient, URI.create(sink.getUrl()), sink.getTimeout()),
        sink.getRetry().toPolicy());
  }

  @Bean
  RabbitQueueClientFactory queueClientFactory(BrokerProperties brokerProperties) {
    return new RabbitQueueClientFactory(brokerProperties);
  }

  @Bean
  WorkerMetrics workerMetrics(MeterRegistry meterRegistry) {
    return new WorkerMetrics(meterRegistry);
  }

  @Bean
  WorkerLoopRunner workerLoopRunner(TranscriberProperties properties,
                                    BrokerProperties brokerProperties,
                                    RabbitQueueClientFactory queueClientFactory,
                                    TranscriptionInvoker transcriptionInvoker,
                                    ResultDelivery resultDelivery,
                                    WorkerMetrics workerMetrics,
                                    Clock clock) {
    TranscriberProperties.Worker worker = properties.getWorker();
    WorkerSettings settings = new WorkerSettings(
        worker.getPollTimeout(),
        worker.getTransientRequeueDelay(),
        worker.getMaxDeliveries(),
        worker.isDeliverFailures(),
        brokerProperties.getReconnect().toUnboundedPolicy());
    return new WorkerLoopRunner(index -> {
      String name = InstanceNameGenerator.generate("transcriber", brokerProperties.getQueueName());
      return new WorkerLoop(name, queueClientFactory.create(name), transcriptionInvoker, resultDelivery, settings,
          workerMetrics, clock);
    }, worker.getConsumers(), worker.getShutdownGrace());
  }
}
