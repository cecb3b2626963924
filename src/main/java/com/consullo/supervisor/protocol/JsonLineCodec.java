package com.consullo.supervisor.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.Validate;

/**
 * JSON codec for newline-delimited message streams.
 *
 * <p>
 * Encoded messages never contain a raw line break: string content is escaped, so one
 * message maps to one line. Unknown fields are ignored when decoding.
 * </p>
 *
 * @since 1.0
 */
public final class JsonLineCodec {

  private final ObjectMapper mapper;

  public JsonLineCodec() {
    this.mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);
  }

  /**
   * @param message message to encode
   * @return single-line JSON, without the terminating newline
   * @throws JsonProcessingException if the message cannot be serialized
   */
  public String encode(final Object message) throws JsonProcessingException {
    Validate.notNull(message, "message must not be null");
    return this.mapper.writeValueAsString(message);
  }

  /**
   * @param line one JSON line
   * @param type message class
   * @param <T> message type
   * @return decoded message
   * @throws JsonProcessingException if the line is not valid JSON for the type
   */
  public <T> T decode(final String line, final Class<T> type) throws JsonProcessingException {
    Validate.notNull(line, "line must not be null");
    return this.mapper.readValue(line, type);
  }

  public HostRequest decodeRequest(final String line) throws JsonProcessingException {
    final HostRequest request = decode(line, HostRequest.class);
    if (request.type() == null) {
      throw new IllegalArgumentException("Request without type: " + line);
    }
    return request;
  }

  public HostResponse decodeResponse(final String line) throws JsonProcessingException {
    final HostResponse response = decode(line, HostResponse.class);
    if (response.type() == null) {
      throw new IllegalArgumentException("Response without type: " + line);
    }
    return response;
  }

  public ObjectMapper mapper() {
    return this.mapper;
  }
}
