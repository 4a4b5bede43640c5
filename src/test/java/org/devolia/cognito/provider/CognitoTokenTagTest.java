package org.devolia.cognito.provider;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.devolia.cognito.model.CredentialSet;
import org.devolia.cognito.model.CredentialValidationException;
import org.devolia.cognito.model.TokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for CognitoTokenTag.
 *
 * @author Devolia
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CognitoTokenTagTest {

  @Mock private CognitoTokenProvider provider;

  private CognitoTokenTag tag;

  @BeforeEach
  void setUp() {
    tag = new CognitoTokenTag(provider);
  }

  @Test
  void testArgumentsInPositionalOrder() {
    List<String> names =
        tag.getArguments().stream()
            .map(TagArgument::getDisplayName)
            .collect(Collectors.toList());

    assertEquals(
        List.of(
            "Username",
            "Password",
            "Region",
            "ClientId",
            "UserPoolId",
            "TokenType",
            "ClientSecret"),
        names);
  }

  @Test
  void testRequiredArgumentsValidateEmptyValues() {
    TagArgument username = tag.getArguments().get(0);

    assertTrue(username.isRequired());
    assertEquals("Required", username.validate(""));
    assertEquals("Required", username.validate(null));
    assertEquals("", username.validate("alice"));

    TagArgument clientSecret = tag.getArguments().get(6);
    assertFalse(clientSecret.isRequired());
    assertEquals("", clientSecret.validate(""));
  }

  @Test
  void testTokenTypeChoices() {
    TagArgument tokenType = tag.getArguments().get(5);

    assertEquals(TagArgument.Type.ENUM, tokenType.getType());
    assertEquals("access", tokenType.getDefaultValue());
    assertEquals(
        List.of("access", "id", "raw_request"),
        tokenType.getOptions().stream()
            .map(TagArgument.Option::getValue)
            .collect(Collectors.toList()));
    assertEquals("Raw Request", tokenType.getOptions().get(2).getDisplayName());
  }

  @Test
  void testRunWithPositionalArguments() {
    when(provider.resolveToken(any(CredentialSet.class))).thenReturn("tok123");

    String result =
        tag.run("alice", "s3cret", "us-east-1", "client-1", "us-east-1_AbCdEf", "id", "shh");

    assertEquals("tok123", result);
    ArgumentCaptor<CredentialSet> captor = ArgumentCaptor.forClass(CredentialSet.class);
    verify(provider).resolveToken(captor.capture());
    CredentialSet credentials = captor.getValue();
    assertEquals("alice", credentials.getUsername());
    assertEquals("us-east-1_AbCdEf", credentials.getUserPoolId());
    assertEquals(TokenType.ID, credentials.getTokenType());
    assertEquals("shh", credentials.getClientSecret());
  }

  @Test
  void testRunWithNamedArguments() {
    when(provider.resolveToken(any(CredentialSet.class)))
        .thenReturn("Incorrect username or password.");

    Map<String, String> arguments = new HashMap<>();
    arguments.put(CognitoTokenTag.ARG_USERNAME, "alice");
    arguments.put(CognitoTokenTag.ARG_PASSWORD, "wrong");
    arguments.put(CognitoTokenTag.ARG_REGION, "us-east-1");
    arguments.put(CognitoTokenTag.ARG_CLIENT_ID, "client-1");
    arguments.put(CognitoTokenTag.ARG_USER_POOL_ID, "us-east-1_AbCdEf");

    assertEquals("Incorrect username or password.", tag.run(arguments));

    ArgumentCaptor<CredentialSet> captor = ArgumentCaptor.forClass(CredentialSet.class);
    verify(provider).resolveToken(captor.capture());
    assertEquals(TokenType.ACCESS, captor.getValue().getTokenType());
    assertFalse(captor.getValue().hasClientSecret());
  }

  @Test
  void testUnknownTokenTypeIsRejected() {
    assertThrows(
        CredentialValidationException.class,
        () ->
            tag.run(
                "alice", "s3cret", "us-east-1", "client-1", "us-east-1_AbCdEf", "refresh", null));
    verifyNoInteractions(provider);
  }

  @Test
  void testMissingUsernameIsReportedBeforeUnknownTokenType() {
    CredentialValidationException exception =
        assertThrows(
            CredentialValidationException.class,
            () ->
                tag.run(null, "s3cret", "us-east-1", "client-1", "us-east-1_AbCdEf", "ID", null));
    assertEquals("Username attribute is required", exception.getMessage());

    exception =
        assertThrows(
            CredentialValidationException.class,
            () ->
                tag.run(
                    null, "s3cret", "us-east-1", "client-1", "us-east-1_AbCdEf", "refresh", null));
    assertEquals("Username attribute is required", exception.getMessage());
    verifyNoInteractions(provider);
  }

  @Test
  void testTokenTypeArgumentIsCaseInsensitive() {
    when(provider.resolveToken(any(CredentialSet.class))).thenReturn("tok123");

    tag.run("alice", "s3cret", "us-east-1", "client-1", "us-east-1_AbCdEf", "ID", null);

    ArgumentCaptor<CredentialSet> captor = ArgumentCaptor.forClass(CredentialSet.class);
    verify(provider).resolveToken(captor.capture());
    assertEquals(TokenType.ID, captor.getValue().getTokenType());
  }

  @Test
  void testTagMetadata() {
    assertEquals("AwsCognitoToken", CognitoTokenTag.NAME);
    assertEquals("AWS Cognito Token", CognitoTokenTag.DISPLAY_NAME);
  }
}
