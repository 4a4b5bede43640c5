package org.devolia.cognito.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for TokenType.
 *
 * @author Devolia
 * @since 1.0.0
 */
class TokenTypeTest {

  @Test
  void testFromValue() {
    assertEquals(TokenType.ACCESS, TokenType.fromValue("access"));
    assertEquals(TokenType.ID, TokenType.fromValue("id"));
    assertEquals(TokenType.RAW_REQUEST, TokenType.fromValue("raw_request"));
    assertEquals(TokenType.ID, TokenType.fromValue(" id "));
    assertEquals(TokenType.ID, TokenType.fromValue("ID"));
    assertEquals(TokenType.RAW_REQUEST, TokenType.fromValue("Raw_Request"));
  }

  @Test
  void testBlankValueDefaultsToAccess() {
    assertEquals(TokenType.ACCESS, TokenType.fromValue(null));
    assertEquals(TokenType.ACCESS, TokenType.fromValue(""));
    assertEquals(TokenType.ACCESS, TokenType.fromValue("   "));
  }

  @Test
  void testUnknownValueIsRejected() {
    CredentialValidationException exception =
        assertThrows(CredentialValidationException.class, () -> TokenType.fromValue("refresh"));
    assertEquals("TokenType", exception.getAttribute());
    assertTrue(exception.getMessage().contains("refresh"));
  }

  @Test
  void testToStringIsWireValue() {
    assertEquals("access", TokenType.ACCESS.toString());
    assertEquals("raw_request", TokenType.RAW_REQUEST.getValue());
  }
}
