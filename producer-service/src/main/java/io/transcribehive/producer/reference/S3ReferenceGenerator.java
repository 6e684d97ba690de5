package io.transcribehive.producer.reference;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

/**
 * {@link ReferenceGenerator} backed by S3 {@code ListObjectsV2} and presigned {@code GetObject}
 * requests. Presigning happens locally; only listing talks to the store.
 */
public class S3ReferenceGenerator implements ReferenceGenerator {

  private final S3Client s3;
  private final S3Presigner presigner;

  public S3ReferenceGenerator(S3Client s3, S3Presigner presigner) {
    this.s3 = Objects.requireNonNull(s3, "s3");
    this.presigner = Objects.requireNonNull(presigner, "presigner");
  }

  @Override
  public Iterable<String> objectKeys(ObjectSelector selector) {
    Objects.requireNonNull(selector, "selector");
    ListObjectsV2Request.Builder request = ListObjectsV2Request.builder()
        .bucket(selector.bucket())
        .prefix(selector.prefix());
    selector.startAfter().ifPresent(request::startAfter);
    ListObjectsV2Request listRequest = request.build();
    return () -> new TranslatingIterator(selector.bucket(), listRequest);
  }

  @Override
  public SignedReference sign(String bucket, String key, Duration validity) {
    GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
        .signatureDuration(validity)
        .getObjectRequest(get -> get.bucket(bucket).key(key))
        .build();
    try {
      PresignedGetObjectRequest presigned = presigner.presignGetObject(presignRequest);
      URI url = presigned.url().toURI();
      return new SignedReference(key, url, presigned.expiration());
    } catch (SdkException ex) {
      throw ObjectStoreErrors.translate("Presigning '" + key + "'", bucket, ex);
    } catch (URISyntaxException ex) {
      throw new ObjectStoreException("Presigned URL for '" + key + "' is not a valid URI", ex);
    }
  }

  /**
   * Walks the paginated listing; the SDK fetches the next page on demand.
   */
  private final class TranslatingIterator implements Iterator<String> {

    private final String bucket;
    private final Iterator<S3Object> delegate;

    TranslatingIterator(String bucket, ListObjectsV2Request request) {
      this.bucket = bucket;
      try {
        this.delegate = s3.listObjectsV2Paginator(request).contents().iterator();
      } catch (SdkException ex) {
        throw ObjectStoreErrors.translate("Listing", bucket, ex);
      }
    }

    @Override
    public boolean hasNext() {
      try {
        return delegate.hasNext();
      } catch (SdkException ex) {
        throw ObjectStoreErrors.translate("Listing", bucket, ex);
      }
    }

    @Override
    public String next() {
      try {
        return delegate.next().key();
      } catch (SdkException ex) {
        throw ObjectStoreErrors.translate("Listing", bucket, ex);
      }
    }
  }
}
