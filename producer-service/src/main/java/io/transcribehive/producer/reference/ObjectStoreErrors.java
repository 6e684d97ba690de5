package io.transcribehive.producer.reference;

import java.util.Locale;
import java.util.Set;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;

/**
 * Translates AWS SDK failures into the object store exception hierarchy.
 */
final class ObjectStoreErrors {

  private static final Set<String> ACCESS_CODES = Set.of(
      "AccessDenied",
      "InvalidAccessKeyId",
      "SignatureDoesNotMatch",
      "ExpiredToken",
      "InvalidToken",
      "AllAccessDisabled");

  private ObjectStoreErrors() {
  }

  static ObjectStoreException translate(String action, String bucket, SdkException ex) {
    String message = action + " on bucket '" + bucket + "' failed: " + ex.getMessage();
    if (ex instanceof NoSuchBucketException) {
      return new ObjectStoreNotFoundException(message, ex);
    }
    if (ex instanceof AwsServiceException service) {
      String code = service.awsErrorDetails() == null ? null : service.awsErrorDetails().errorCode();
      if ("NoSuchBucket".equals(code) || service.statusCode() == 404) {
        return new ObjectStoreNotFoundException(message, ex);
      }
      if ((code != null && ACCESS_CODES.contains(code)) || service.statusCode() == 403) {
        return new ObjectStoreAccessException(message, ex);
      }
      return new ObjectStoreException(message, ex);
    }
    if (ex instanceof SdkClientException && mentionsCredentials(ex.getMessage())) {
      return new ObjectStoreAccessException(message, ex);
    }
    return new ObjectStoreException(message, ex);
  }

  private static boolean mentionsCredentials(String message) {
    return message != null && message.toLowerCase(Locale.ROOT).contains("credentials");
  }
}
