package io.transcribehive.transcriber;

import io.transcribehive.retry.RetryProperties;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "transcribehive.transcriber")
public class TranscriberProperties {

  private final Worker worker = new Worker();
  private final Asr asr = new Asr();
  private final Sink sink = new Sink();
  private final Usage usage = new Usage();

  public Worker getWorker() {
    return worker;
  }

  public Asr getAsr() {
    return asr;
  }

  public Sink getSink() {
    return sink;
  }

  public Usage getUsage() {
    return usage;
  }

  public static class Worker {

    /** Independent loops in this process ({@code WORKER_CONSUMERS}). */
    private int consumers = 1;
    private Duration pollTimeout = Duration.ofSeconds(1);
    private Duration transientRequeueDelay = Duration.ofSeconds(5);
    /** 0 disables the ceiling. Needs a queue type that reports {@code x-delivery-count}. */
    private int maxDeliveries;
    private boolean deliverFailures = true;
    private Duration shutdownGrace = Duration.ofSeconds(30);

    public int getConsumers() {
      return consumers;
    }

    public void setConsumers(int consumers) {
      this.consumers = Math.max(1, consumers);
    }

    public Duration getPollTimeout() {
      return pollTimeout;
    }

    public void setPollTimeout(Duration pollTimeout) {
      this.pollTimeout = pollTimeout;
    }

    public Duration getTransientRequeueDelay() {
      return transientRequeueDelay;
    }

    public void setTransientRequeueDelay(Duration transientRequeueDelay) {
      this.transientRequeueDelay = transientRequeueDelay;
    }

    public int getMaxDeliveries() {
      return maxDeliveries;
    }

    public void setMaxDeliveries(int maxDeliveries) {
      this.maxDeliveries = Math.max(0, maxDeliveries);
    }

    public boolean isDeliverFailures() {
      return deliverFailures;
    }

    public void setDeliverFailures(boolean deliverFailures) {
      this.deliverFailures = deliverFailures;
    }

    public Duration getShutdownGrace() {
      return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
      this.shutdownGrace = shutdownGrace;
    }
  }

  public static class Asr {

    public enum Engine {
      HTTP,
      PROCESS
    }

    private Engine engine = Engine.HTTP;
    private String url = "http://localhost:8000/v2/jobs";
    private List<String> command = List.of("pipeline");
    private Path workDir = Path.of(System.getProperty("java.io.tmpdir"), "transcribehive");
    private String language = "en";
    private Duration timeout = Duration.ofMinutes(10);
    private RetryProperties retry = new RetryProperties(1, Duration.ofSeconds(1), Duration.ofSeconds(10));

    public Engine getEngine() {
      return engine;
    }

    public void setEngine(Engine engine) {
      this.engine = engine == null ? Engine.HTTP : engine;
    }

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public List<String> getCommand() {
      return command;
    }

    public void setCommand(List<String> command) {
      this.command = command;
    }

    public Path getWorkDir() {
      return workDir;
    }

    public void setWorkDir(Path workDir) {
      this.workDir = workDir;
    }

    public String getLanguage() {
      return language;
    }

    public void setLanguage(String language) {
      this.language = language;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public RetryProperties getRetry() {
      return retry;
    }

    public void setRetry(RetryProperties retry) {
      this.retry = retry;
    }
  }

  public static class Sink {

    /** Callback endpoint ({@code CALLBACK_SERVER}). */
    private String url = "http://localhost:8080";
    private Duration timeout = Duration.ofSeconds(30);
    private RetryProperties retry = new RetryProperties(5, Duration.ofSeconds(1), Duration.ofSeconds(30));

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public RetryProperties getRetry() {
      return retry;
    }

    public void setRetry(RetryProperties retry) {
      this.retry = retry;
    }
  }

  public static class Usage {

    /** Usage collector ({@code SM_EATS_URL}); events are only logged when empty. */
    private String url = "";
    private Duration timeout = Duration.ofSeconds(5);

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url == null ? "" : url.trim();
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }
  }
}
