/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.redis;

/**
 * Converts stored values to and from the string form kept in Redis hashes.
 *
 * <p><strong>Contract:</strong> {@code decode(encode(v))} must be equal to {@code v} for every
 * value the application stores, modulo the representation the codec documents (e.g. JSON objects
 * decode to {@code Map}s). Both methods throw {@link
 * com.macstab.oss.kvspace.backend.BackendException} on failure.
 *
 * <p><strong>Thread Safety:</strong> implementations MUST be thread-safe.
 *
 * @see JacksonValueCodec
 * @author Christian Schnapka - Macstab GmbH
 */
public interface ValueCodec {

  String encode(Object value);

  Object decode(String encoded);
}
