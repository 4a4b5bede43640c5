package org.devolia.cognito.cache;

import static org.junit.jupiter.api.Assertions.*;

import org.devolia.cognito.model.CredentialSet;
import org.devolia.cognito.model.TokenType;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for CacheKey.
 *
 * @author Devolia
 * @since 1.0.0
 */
class CacheKeyTest {

  private static CredentialSet.Builder credentials() {
    return CredentialSet.builder()
        .username("alice")
        .password("pw")
        .region("eu-west-1")
        .clientId("client")
        .userPoolId("eu-west-1_Pool");
  }

  @Test
  void testKeyJoinsAllAttributes() {
    CacheKey key = CacheKey.of(credentials().tokenType(TokenType.ID).clientSecret("shh").build());

    assertEquals("alice::pw::eu-west-1::client::eu-west-1_Pool::id::shh", key.value());
  }

  @Test
  void testAbsentClientSecretBecomesEmptyString() {
    CacheKey key = CacheKey.of(credentials().build());

    assertEquals("alice::pw::eu-west-1::client::eu-west-1_Pool::access::", key.value());
  }

  @Test
  void testKeyIsDeterministic() {
    assertEquals(CacheKey.of(credentials().build()), CacheKey.of(credentials().build()));
    assertEquals(
        CacheKey.of(credentials().build()).hashCode(),
        CacheKey.of(credentials().build()).hashCode());
  }

  @Test
  void testTokenTypesCacheIndependently() {
    CacheKey access = CacheKey.of(credentials().tokenType(TokenType.ACCESS).build());
    CacheKey id = CacheKey.of(credentials().tokenType(TokenType.ID).build());
    CacheKey raw = CacheKey.of(credentials().tokenType(TokenType.RAW_REQUEST).build());

    assertNotEquals(access, id);
    assertNotEquals(access, raw);
  }

  @Test
  void testEveryAttributeChangesTheKey() {
    CacheKey base = CacheKey.of(credentials().build());

    assertNotEquals(base, CacheKey.of(credentials().username("bob").build()));
    assertNotEquals(base, CacheKey.of(credentials().password("other").build()));
    assertNotEquals(base, CacheKey.of(credentials().region("us-east-1").build()));
    assertNotEquals(base, CacheKey.of(credentials().clientId("other").build()));
    assertNotEquals(base, CacheKey.of(credentials().userPoolId("eu-west-1_Other").build()));
    assertNotEquals(base, CacheKey.of(credentials().clientSecret("x").build()));
  }

  @Test
  void testToStringIsMasked() {
    String text = CacheKey.of(credentials().build()).toString();

    assertEquals("al***", text);
    assertFalse(text.contains("pw"));
    assertEquals("***", CacheKey.mask(null));
    assertEquals("***", CacheKey.mask("abc"));
  }
}
