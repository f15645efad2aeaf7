package com.scholary.vocab.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileAccessTokenProviderTest {

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void accessToken_shouldReadRawToken() throws Exception {
    Path file = tempDir.resolve("token.txt");
    Files.writeString(file, "ya29.raw-token\n");

    assertThat(new FileAccessTokenProvider(file, objectMapper).accessToken())
        .isEqualTo("ya29.raw-token");
  }

  @Test
  void accessToken_shouldReadTokenFieldFromJson() throws Exception {
    Path file = tempDir.resolve("token.json");
    Files.writeString(file, "{\"token\":\"ya29.json-token\",\"refresh_token\":\"r\"}");

    assertThat(new FileAccessTokenProvider(file, objectMapper).accessToken())
        .isEqualTo("ya29.json-token");
  }

  @Test
  void accessToken_shouldFallBackToAccessTokenField() throws Exception {
    Path file = tempDir.resolve("token.json");
    Files.writeString(file, "{\"access_token\":\"ya29.oauth\",\"expires_in\":3599}");

    assertThat(new FileAccessTokenProvider(file, objectMapper).accessToken())
        .isEqualTo("ya29.oauth");
  }

  @Test
  void accessToken_shouldReloadWhenFileChanges() throws Exception {
    Path file = tempDir.resolve("token.txt");
    Files.writeString(file, "first");
    Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2024-01-01T00:00:00Z")));
    FileAccessTokenProvider provider = new FileAccessTokenProvider(file, objectMapper);
    assertThat(provider.accessToken()).isEqualTo("first");

    Files.writeString(file, "second");
    Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2024-01-01T01:00:00Z")));

    assertThat(provider.accessToken()).isEqualTo("second");
  }

  @Test
  void accessToken_shouldFailWhenFileIsMissing() {
    FileAccessTokenProvider provider =
        new FileAccessTokenProvider(tempDir.resolve("missing.json"), objectMapper);

    assertThatThrownBy(provider::accessToken)
        .isInstanceOf(GatewayAuthenticationException.class)
        .hasMessageContaining("missing.json");
  }

  @Test
  void accessToken_shouldFailWhenNotConfigured() {
    assertThatThrownBy(() -> new FileAccessTokenProvider(null, objectMapper).accessToken())
        .isInstanceOf(GatewayAuthenticationException.class);
  }

  @Test
  void accessToken_shouldFailForJsonWithoutToken() throws Exception {
    Path file = tempDir.resolve("token.json");
    Files.writeString(file, "{\"refresh_token\":\"r\"}");

    assertThatThrownBy(() -> new FileAccessTokenProvider(file, objectMapper).accessToken())
        .isInstanceOf(GatewayAuthenticationException.class);
  }
}
