package com.scholary.vocab.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an access token from a file.
 *
 * <p>The file holds either the raw token (as written by {@code gcloud auth print-access-token}) or
 * an OAuth token JSON with a {@code token} or {@code access_token} field. The file is re-read
 * whenever its modification time changes, so an external refresher can rotate the token while a
 * run is in progress.
 */
public class FileAccessTokenProvider implements AccessTokenProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileAccessTokenProvider.class);

  private final Path tokenFile;
  private final ObjectMapper objectMapper;

  private FileTime loadedAt;
  private String token;

  public FileAccessTokenProvider(Path tokenFile, ObjectMapper objectMapper) {
    this.tokenFile = tokenFile;
    this.objectMapper = objectMapper;
  }

  @Override
  public synchronized String accessToken() {
    if (tokenFile == null) {
      throw new GatewayAuthenticationException("No credential token file configured");
    }
    try {
      FileTime modified = Files.getLastModifiedTime(tokenFile);
      if (token == null || !modified.equals(loadedAt)) {
        token = parse(Files.readString(tokenFile, StandardCharsets.UTF_8));
        loadedAt = modified;
        LOGGER.debug("Loaded access token from {}", tokenFile);
      }
      return token;
    } catch (IOException e) {
      throw new GatewayAuthenticationException("Cannot read credential token file: " + tokenFile, e);
    }
  }

  private String parse(String content) throws IOException {
    String trimmed = content.strip();
    if (trimmed.startsWith("{")) {
      JsonNode json = objectMapper.readTree(trimmed);
      JsonNode value = json.hasNonNull("token") ? json.get("token") : json.get("access_token");
      if (value == null || value.asText().isBlank()) {
        throw new GatewayAuthenticationException(
            "Token file has neither a 'token' nor an 'access_token' field: " + tokenFile);
      }
      return value.asText();
    }
    if (trimmed.isEmpty()) {
      throw new GatewayAuthenticationException("Credential token file is empty: " + tokenFile);
    }
    return trimmed;
  }
}
