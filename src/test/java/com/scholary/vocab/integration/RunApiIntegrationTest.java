package com.scholary.vocab.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.vocab.gateway.StubHttpServer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/**
 * End-to-end test of the run API.
 *
 * <p>A local stub server stands in for both the translation and the speech service, so a run goes
 * through the whole pipeline and writes real files into a temporary directory.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class RunApiIntegrationTest {

  private static final Path WORK_DIR = createWorkDir();
  private static final StubHttpServer GOOGLE = startStub();

  @Autowired private TestRestTemplate restTemplate;

  @DynamicPropertySource
  static void configureProperties(DynamicPropertyRegistry registry) {
    registry.add("pipeline.workDir", WORK_DIR::toString);
    registry.add("pipeline.audioDir", () -> WORK_DIR.resolve("media").toString());
    registry.add("pipeline.cacheDir", () -> WORK_DIR.resolve("cache").toString());
    registry.add("pipeline.romanize", () -> "false");
    registry.add("pipeline.termTimeoutSeconds", () -> "10");
    registry.add("translation.baseUrl", GOOGLE::baseUrl);
    registry.add("translation.tokenFile", () -> WORK_DIR.resolve("token.txt").toString());
    registry.add("translation.maxRetries", () -> "1");
    registry.add("speech.baseUrl", GOOGLE::baseUrl);
    registry.add("speech.tokenFile", () -> WORK_DIR.resolve("token.txt").toString());
    registry.add("speech.maxRetries", () -> "1");
  }

  @AfterAll
  static void stopStub() {
    GOOGLE.close();
  }

  @Test
  void startRun_shouldWriteTableAndAudio() throws Exception {
    byte[] audio = "ID3-fake-mp3".getBytes(StandardCharsets.UTF_8);
    GOOGLE
        .reply(200, "{\"translations\":[{\"translatedText\":\"Porridge\"}]}")
        .reply(
            200,
            "{\"audioContent\":\"" + Base64.getEncoder().encodeToString(audio) + "\"}");
    Path input = write("single.txt", "Каша\n");
    Path output = WORK_DIR.resolve("single.csv");

    JsonNode status = awaitFinished(submit(Map.of("input", input, "output", output)));

    assertThat(status.get("phase").asText()).isEqualTo("DONE");
    assertThat(status.get("report").get("recordsWritten").asInt()).isEqualTo(1);
    assertThat(Files.readString(output, StandardCharsets.UTF_8))
        .isEqualTo("Каша;;[sound:RT_VOCAB0001.mp3];Porridge;\n");
    assertThat(WORK_DIR.resolve("media").resolve("RT_VOCAB0001.mp3")).hasBinaryContent(audio);
    assertThat(GOOGLE.requests())
        .extracting(StubHttpServer.Recorded::authorization)
        .containsOnly("Bearer integration-token");
  }

  @Test
  void startRun_shouldReportFailureForMissingInput() throws Exception {
    Path output = WORK_DIR.resolve("missing.csv");

    JsonNode status =
        awaitFinished(submit(Map.of("input", WORK_DIR.resolve("nope.txt"), "output", output)));

    assertThat(status.get("phase").asText()).isEqualTo("FAILED");
    assertThat(status.get("report").get("error").asText()).contains("nope.txt");
    assertThat(output).doesNotExist();
  }

  @Test
  void startRun_shouldRejectBlankInput() {
    ResponseEntity<JsonNode> response =
        restTemplate.postForEntity(
            "/api/runs", Map.of("input", "", "output", "out.csv"), JsonNode.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().get("code").asText()).isEqualTo("VALIDATION_ERROR");
  }

  @Test
  void startRun_shouldRejectOutputOutsideWorkDir() {
    ResponseEntity<JsonNode> response =
        restTemplate.postForEntity(
            "/api/runs", Map.of("input", "single.txt", "output", "../escape.csv"), JsonNode.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().get("code").asText()).isEqualTo("INVALID_REQUEST");
    assertThat(WORK_DIR.resolveSibling("escape.csv")).doesNotExist();
  }

  @Test
  void startRun_shouldRejectAbsoluteInputOutsideWorkDir() {
    ResponseEntity<JsonNode> response =
        restTemplate.postForEntity(
            "/api/runs", Map.of("input", "/etc/passwd", "output", "out.csv"), JsonNode.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().get("code").asText()).isEqualTo("INVALID_REQUEST");
  }

  @Test
  void status_shouldReturnNotFoundForUnknownRun() {
    ResponseEntity<JsonNode> response =
        restTemplate.getForEntity("/api/runs/does-not-exist", JsonNode.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void cancel_shouldConflictOnceRunHasFinished() throws Exception {
    Path input = write("empty.txt", "# nothing to learn\n");
    String statusUrl = submit(Map.of("input", input, "output", WORK_DIR.resolve("empty.csv")));
    awaitFinished(statusUrl);

    ResponseEntity<JsonNode> response =
        restTemplate.exchange(statusUrl, HttpMethod.DELETE, null, JsonNode.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody().get("phase").asText()).isEqualTo("DONE");
  }

  /** Submit a run and return its status URL. */
  private String submit(Map<String, Path> paths) {
    Map<String, String> body =
        Map.of("input", paths.get("input").toString(), "output", paths.get("output").toString());
    ResponseEntity<JsonNode> response =
        restTemplate.postForEntity("/api/runs", body, JsonNode.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
    return response.getBody().get("statusUrl").asText();
  }

  private JsonNode awaitFinished(String statusUrl) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 15_000;
    while (System.currentTimeMillis() < deadline) {
      JsonNode status = restTemplate.getForObject(statusUrl, JsonNode.class);
      if (status.hasNonNull("report")) {
        return status;
      }
      Thread.sleep(50);
    }
    throw new AssertionError("Run did not finish in time: " + statusUrl);
  }

  private static Path write(String name, String content) throws IOException {
    Path file = WORK_DIR.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }

  private static Path createWorkDir() {
    try {
      Path dir = Files.createTempDirectory("vocab-it");
      Files.writeString(dir.resolve("token.txt"), "integration-token\n");
      return dir;
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static StubHttpServer startStub() {
    try {
      return new StubHttpServer();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
