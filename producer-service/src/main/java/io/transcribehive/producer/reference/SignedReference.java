package io.transcribehive.producer.reference;

import java.net.URI;
import java.time.Instant;

/**
 * @param url presigned URL; carries credentials in its query string, never log it unredacted
 * @param expiresAt instant the signature stops being accepted
 */
public record SignedReference(String key, URI url, Instant expiresAt) {
}
