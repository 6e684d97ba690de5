package io.transcribehive.producer;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.time.Duration;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ProducerPropertiesTest {

  private static ValidatorFactory factory;
  private static Validator validator;

  @BeforeAll
  static void createValidator() {
    factory = Validation.buildDefaultValidatorFactory();
    validator = factory.getValidator();
  }

  @AfterAll
  static void closeValidator() {
    factory.close();
  }

  @Test
  void bucketIsRequired() {
    ProducerProperties properties = new ProducerProperties();

    Set<ConstraintViolation<ProducerProperties>> violations = validator.validate(properties);

    assertThat(violations).extracting(v -> v.getPropertyPath().toString()).containsExactly("bucket");
  }

  @Test
  void rejectsValidityWindowShorterThanTheMinimum() {
    ProducerProperties properties = new ProducerProperties();
    properties.setBucket("media");
    properties.setValidityWindow(Duration.ofMinutes(2));

    Set<ConstraintViolation<ProducerProperties>> violations = validator.validate(properties);

    assertThat(violations).extracting(ConstraintViolation::getMessage)
        .containsExactly("validity-window must be at least min-validity-window");
  }

  @Test
  void blankPrefixFallsBackToWholeBucket() {
    ProducerProperties properties = new ProducerProperties();
    properties.setPrefix("  ");

    assertThat(properties.getPrefix()).isEqualTo("/");
    assertThat(properties.getPublishRetry().getMaxAttempts()).isEqualTo(3);
  }
}
