/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.macstab.oss.kvspace.backend.BackendException;

import lombok.NonNull;

/**
 * {@link ValueCodec} writing values as JSON.
 *
 * <p>Values decode to plain JSON types: {@code String}, {@code Integer}/{@code Long}/{@code
 * BigInteger}, {@code Double}, {@code Boolean}, {@code List} and {@code Map}. Application types are
 * therefore stored by their properties and read back as maps. {@code null} round-trips as {@code
 * null}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
public final class JacksonValueCodec implements ValueCodec {

  private final ObjectMapper mapper;

  public JacksonValueCodec() {
    this(new ObjectMapper());
  }

  public JacksonValueCodec(@NonNull final ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public String encode(final Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (final JsonProcessingException e) {
      throw new BackendException(
          "Cannot encode value of type " + value.getClass().getName() + " as JSON", e);
    }
  }

  @Override
  public Object decode(final String encoded) {
    if (encoded == null) {
      return null;
    }
    try {
      return mapper.readValue(encoded, Object.class);
    } catch (final JsonProcessingException e) {
      throw new BackendException("Stored value is not valid JSON", e);
    }
  }
}
