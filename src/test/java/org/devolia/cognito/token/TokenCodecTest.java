package org.devolia.cognito.token;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TokenCodec.
 *
 * @author Devolia
 * @since 1.0.0
 */
class TokenCodecTest {

  private static String segment(String json) {
    return Base64.getUrlEncoder()
        .withoutPadding()
        .encodeToString(json.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void testEncodeProducesTwoUnpaddedUrlSafeSegments() {
    Map<String, Object> header = new LinkedHashMap<>();
    header.put("alg", "HS256");
    header.put("typ", "JWT");
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("error", "Incorrect username or password.");
    payload.put("exp", 1700000060L);

    String token = TokenCodec.encode(header, payload);

    String[] segments = token.split("\\.");
    assertEquals(2, segments.length);
    assertEquals(segment("{\"alg\":\"HS256\",\"typ\":\"JWT\"}"), segments[0]);
    assertFalse(token.contains("="));
    assertFalse(token.contains("+"));
    assertFalse(token.contains("/"));
  }

  @Test
  void testDecodeTwoSegmentToken() {
    String token = segment("{\"alg\":\"none\"}") + "." + segment("{\"sub\":\"alice\",\"exp\":42}");

    DecodedToken decoded = TokenCodec.decode(token);

    assertEquals("none", decoded.getHeader().get("alg"));
    assertEquals("alice", decoded.getPayload().get("sub"));
    assertEquals(42.0, decoded.getExpiresAt());
    assertNull(decoded.getNotBefore());
    assertFalse(decoded.isError());
  }

  @Test
  void testDecodeSignedTokenIgnoresSignature() {
    String token =
        segment("{\"alg\":\"RS256\",\"kid\":\"k1\"}")
            + "."
            + segment("{\"token_use\":\"access\",\"exp\":1700003600.5}")
            + ".c2lnbmF0dXJl";

    DecodedToken decoded = TokenCodec.decode(token);

    assertEquals("RS256", decoded.getHeader().get("alg"));
    assertEquals(1700003600.5, decoded.getExpiresAt());
  }

  @Test
  void testDecodeErrorToken() {
    String token =
        segment("{\"alg\":\"HS256\",\"typ\":\"JWT\"}")
            + "."
            + segment("{\"error\":\"User does not exist.\",\"exp\":100}");

    DecodedToken decoded = TokenCodec.decode(token);

    assertTrue(decoded.isError());
    assertEquals("User does not exist.", decoded.getError());
  }

  @Test
  void testDecodeRejectsMalformedTokens() {
    assertThrows(TokenDecodeException.class, () -> TokenCodec.decode(null));
    assertThrows(TokenDecodeException.class, () -> TokenCodec.decode(""));
    assertThrows(TokenDecodeException.class, () -> TokenCodec.decode("not-a-token"));
    assertThrows(TokenDecodeException.class, () -> TokenCodec.decode("a.b.c.d"));
    assertThrows(TokenDecodeException.class, () -> TokenCodec.decode("!!!.###"));
  }

  @Test
  void testDecodeRejectsNonObjectSegments() {
    String header = segment("{\"alg\":\"HS256\"}");

    assertThrows(
        TokenDecodeException.class, () -> TokenCodec.decode(header + "." + segment("[1,2]")));
    assertThrows(
        TokenDecodeException.class, () -> TokenCodec.decode(header + "." + segment("null")));
    assertThrows(
        TokenDecodeException.class, () -> TokenCodec.decode(header + "." + segment("{oops")));
  }

  @Test
  void testNonNumericTimeClaimsAreIgnored() {
    String token =
        segment("{}") + "." + segment("{\"exp\":\"tomorrow\",\"nbf\":true,\"error\":\"\"}");

    DecodedToken decoded = TokenCodec.decode(token);

    assertNull(decoded.getExpiresAt());
    assertNull(decoded.getNotBefore());
    assertFalse(decoded.isError());
  }

  @Test
  void testOnlyNonEmptyStringErrorClaimMarksErrorToken() {
    String header = segment("{\"alg\":\"HS256\"}");

    assertFalse(TokenCodec.decode(header + "." + segment("{\"error\":false}")).isError());
    assertFalse(TokenCodec.decode(header + "." + segment("{\"error\":0}")).isError());
    assertFalse(TokenCodec.decode(header + "." + segment("{\"error\":{\"a\":1}}")).isError());
    assertNull(TokenCodec.decode(header + "." + segment("{\"error\":false}")).getError());

    DecodedToken decoded = TokenCodec.decode(header + "." + segment("{\"error\":\"denied\"}"));
    assertTrue(decoded.isError());
    assertEquals("denied", decoded.getError());
  }

  @Test
  void testUndecodableHeaderStillDecodesPayload() {
    String token = "%%%." + segment("{\"sub\":\"alice\",\"exp\":42}");

    DecodedToken decoded = TokenCodec.decode(token);

    assertTrue(decoded.getHeader().isEmpty());
    assertEquals("alice", decoded.getPayload().get("sub"));
    assertEquals(42.0, decoded.getExpiresAt());

    decoded = TokenCodec.decode(segment("[1]") + "." + segment("{\"exp\":42}") + ".sig");
    assertTrue(decoded.getHeader().isEmpty());
    assertEquals(42.0, decoded.getExpiresAt());
  }
}
