package io.transcribehive.producer.reference;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ObjectSelectorTest {

  @Test
  void defaultPrefixSelectsWholeBucket() {
    ObjectSelector selector = new ObjectSelector("media", "/");

    assertThat(selector.prefix()).isEmpty();
    assertThat(selector.startAfter()).isEmpty();
  }

  @Test
  void directoryPrefixSkipsTheMarkerObject() {
    ObjectSelector selector = new ObjectSelector("media", "/audio/2024/");

    assertThat(selector.prefix()).isEqualTo("audio/2024/");
    assertThat(selector.startAfter()).contains("audio/2024/");
  }

  @Test
  void partialNamePrefixIsUsedAsIs() {
    ObjectSelector selector = new ObjectSelector("media", "audio/call-");

    assertThat(selector.prefix()).isEqualTo("audio/call-");
    assertThat(selector.startAfter()).isEmpty();
  }
}
