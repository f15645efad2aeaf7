package com.scholary.vocab.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audio cache held in Caffeine, optionally mirrored to {@code <cacheDir>/audio/<fingerprint>.bin}.
 *
 * <p>Disk entries are written as soon as they are cached, so audio survives a crash mid-run. Memory
 * is bounded by total payload size rather than entry count since clips vary a lot in length.
 */
public class CaffeineAudioCache implements AudioCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaffeineAudioCache.class);

  private static final String SUFFIX = ".bin";

  private final Cache<String, byte[]> cache;
  private final Path directory;

  public CaffeineAudioCache(int maxMegabytes, Path directory) {
    this.cache =
        Caffeine.newBuilder()
            .maximumWeight(maxMegabytes * 1024L * 1024L)
            .weigher((String key, byte[] audio) -> audio.length)
            .build();
    this.directory = directory;

    LOGGER.info("Initialized audio cache: maxMegabytes={}, directory={}", maxMegabytes, directory);
  }

  @Override
  public void put(String fingerprint, byte[] audio) {
    cache.put(fingerprint, audio);
    if (directory != null) {
      Path target = directory.resolve(fingerprint + SUFFIX);
      try {
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, fingerprint, ".tmp");
        Files.write(temp, audio);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to persist cached audio: " + target, e);
      }
    }
    LOGGER.debug("Cached audio: key={}, bytes={}", fingerprint, audio.length);
  }

  @Override
  public Optional<byte[]> get(String fingerprint) {
    byte[] audio = cache.getIfPresent(fingerprint);
    if (audio != null) {
      LOGGER.debug("Cache hit: key={}", fingerprint);
      return Optional.of(audio);
    }
    if (directory != null) {
      Path source = directory.resolve(fingerprint + SUFFIX);
      if (Files.isRegularFile(source)) {
        try {
          audio = Files.readAllBytes(source);
        } catch (IOException e) {
          throw new UncheckedIOException("Failed to read cached audio: " + source, e);
        }
        cache.put(fingerprint, audio);
        LOGGER.debug("Cache hit on disk: key={}", fingerprint);
        return Optional.of(audio);
      }
    }
    LOGGER.debug("Cache miss: key={}", fingerprint);
    return Optional.empty();
  }
}
