/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import lombok.Getter;
import lombok.NonNull;

/**
 * Structured kvspace failure.
 *
 * <p>Every externally surfaced error carries an {@link ErrorCode} and a details map describing
 * where it happened: the operation, the key (if any), the driver, the database and store and,
 * when wrapping a lower-level failure, the cause's class name and message (see {@link
 * ErrorDetails} for the keys).
 *
 * <p><strong>Wrapping rules:</strong>
 *
 * <ul>
 *   <li>{@link #wrap(Throwable, ErrorCode, String, Map)} on a {@code KvSpaceException} keeps the
 *       original code and merges the new details into it (existing keys win), so the innermost
 *       classification survives every layer.
 *   <li>Any other throwable becomes the {@link #getCause() cause} of a new exception with {@code
 *       causeName} and {@code causeMessage} recorded.
 *   <li>{@link CompletionException} and {@link ExecutionException} are unwrapped first; they are
 *       transport, not failure.
 * </ul>
 *
 * <p>Instances are immutable: {@link #withDetails(Map)} returns a copy.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Getter
public class KvSpaceException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final ErrorCode code;
  private final transient Map<String, Object> details;

  public KvSpaceException(
      @NonNull final ErrorCode code, final String message, final Map<String, Object> details) {
    this(code, message, details, null);
  }

  public KvSpaceException(
      @NonNull final ErrorCode code,
      final String message,
      final Map<String, Object> details,
      final Throwable cause) {
    super(message, cause);
    this.code = code;
    this.details =
        details == null || details.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public static KvSpaceException of(final ErrorCode code, final String message) {
    return new KvSpaceException(code, message, null);
  }

  public static KvSpaceException of(
      final ErrorCode code, final String message, final Map<String, Object> details) {
    return new KvSpaceException(code, message, details);
  }

  /**
   * Converts any failure into a structured one.
   *
   * @param error failure to convert (may be a {@code CompletionException} wrapper)
   * @param code code used when {@code error} is not already structured
   * @param message message used when {@code error} is not already structured
   * @param details context merged into the result
   * @return structured exception, never {@code null}
   */
  public static KvSpaceException wrap(
      final Throwable error,
      final ErrorCode code,
      final String message,
      final Map<String, Object> details) {
    final var cause = unwrap(error);

    if (cause instanceof KvSpaceException structured) {
      return details == null || details.isEmpty() ? structured : structured.withDetails(details);
    }

    final var enriched = new LinkedHashMap<String, Object>();
    if (details != null) {
      enriched.putAll(details);
    }
    if (cause != null) {
      enriched.put(ErrorDetails.CAUSE_NAME, cause.getClass().getName());
      enriched.put(ErrorDetails.CAUSE_MESSAGE, String.valueOf(cause.getMessage()));
    }
    return new KvSpaceException(code, message, enriched, cause);
  }

  /** Strips {@link CompletionException} / {@link ExecutionException} layers. */
  public static Throwable unwrap(final Throwable error) {
    var current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** Returns a copy whose details are merged with {@code extra} (existing keys win). */
  public KvSpaceException withDetails(final Map<String, Object> extra) {
    if (extra == null || extra.isEmpty()) {
      return this;
    }
    final var merged = new LinkedHashMap<String, Object>(extra);
    merged.putAll(details);
    final var copy = new KvSpaceException(code, getMessage(), merged, getCause());
    copy.setStackTrace(getStackTrace());
    return copy;
  }

  public Object getDetail(final String key) {
    return details.get(key);
  }

  @Override
  public String toString() {
    return String.format("KvSpaceException[%s]: %s %s", code, getMessage(), details);
  }
}
