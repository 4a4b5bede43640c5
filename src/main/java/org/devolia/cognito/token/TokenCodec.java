package org.devolia.cognito.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes and decodes unsigned JWT-style tokens.
 *
 * <p>Wire format: the JSON header and the JSON payload are each UTF-8 encoded and Base64-url
 * encoded without padding, then joined with a dot. Decoding also accepts a third (signature)
 * segment so that tokens issued by Cognito can be inspected; the signature is never verified.
 *
 * <p>Only the payload carries the claims used for caching decisions. A header that cannot be
 * decoded is replaced by an empty map instead of failing the whole token.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class TokenCodec {

  private static final Logger logger = LoggerFactory.getLogger(TokenCodec.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> CLAIMS_TYPE =
      new TypeReference<Map<String, Object>>() {};

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private TokenCodec() {}

  /**
   * Encodes a header and payload into a two-segment token.
   *
   * @param header header claims (algorithm and type metadata)
   * @param payload payload claims
   * @return the encoded token
   * @throws IllegalArgumentException if either map cannot be serialized to JSON
   */
  public static String encode(Map<String, ?> header, Map<String, ?> payload) {
    return encodeSegment(header, "header") + "." + encodeSegment(payload, "payload");
  }

  /**
   * Decodes a token into its header and payload claims.
   *
   * @param token the token string
   * @return the decoded claims
   * @throws TokenDecodeException if the token is null or empty, has the wrong number of segments
   *     or its payload is not a Base64-url encoded JSON object
   */
  public static DecodedToken decode(String token) {
    if (token == null || token.isEmpty()) {
      throw new TokenDecodeException("Token is null or empty");
    }

    String[] segments = token.split("\\.", -1);
    if (segments.length < 2 || segments.length > 3) {
      throw new TokenDecodeException(
          "Token must have 2 or 3 segments but has " + segments.length);
    }

    Map<String, Object> payload = decodeSegment(segments[1], "payload");
    return new DecodedToken(decodeHeader(segments[0]), payload);
  }

  private static Map<String, Object> decodeHeader(String segment) {
    try {
      return decodeSegment(segment, "header");
    } catch (TokenDecodeException e) {
      logger.debug("Ignoring undecodable token header: {}", e.getMessage());
      return Collections.emptyMap();
    }
  }

  private static String encodeSegment(Map<String, ?> claims, String name) {
    try {
      byte[] json = MAPPER.writeValueAsBytes(claims);
      return ENCODER.encodeToString(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Could not serialize token " + name, e);
    }
  }

  private static Map<String, Object> decodeSegment(String segment, String name) {
    byte[] json;
    try {
      json = DECODER.decode(segment.getBytes(StandardCharsets.US_ASCII));
    } catch (IllegalArgumentException e) {
      throw new TokenDecodeException("Invalid Base64-url encoding in token " + name, e);
    }

    try {
      Map<String, Object> claims = MAPPER.readValue(json, CLAIMS_TYPE);
      if (claims == null) {
        throw new TokenDecodeException("Token " + name + " is not a JSON object");
      }
      return claims;
    } catch (IOException e) {
      throw new TokenDecodeException("Token " + name + " is not a JSON object", e);
    }
  }
}
