package io.transcribehive.callback;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "callback.capacity=7")
class ApplicationTest {

  @Autowired
  CapturedRequestStore store;

  @Autowired
  TranscriptLedger ledger;

  @Autowired
  PostNotifyAction postNotifyAction;

  @Test
  void contextStartsWithConfiguredCapacity() {
    assertThat(postNotifyAction).isNotNull();
    assertThat(store.capacity()).isEqualTo(7);
    assertThat(ledger.capacity()).isEqualTo(7);
  }
}
