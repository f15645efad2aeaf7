package com.scholary.vocab.audio;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes audio assets into the media directory and finds where numbering left off. */
public class AudioFileStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioFileStore.class);

  private final Path directory;

  public AudioFileStore(Path directory) {
    this.directory = directory;
  }

  /**
   * Write an asset, replacing any file of the same name.
   *
   * @throws UncheckedIOException if the directory or the file cannot be written
   */
  public Path write(AudioAsset asset) {
    Path target = directory.resolve(asset.filename());
    try {
      Files.createDirectories(directory);
      Path temp = Files.createTempFile(directory, asset.filename(), ".tmp");
      Files.write(temp, asset.audio());
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write audio file: " + target, e);
    }
    LOGGER.debug("Wrote audio file: {} ({} bytes)", target, asset.audio().length);
    return target;
  }

  /**
   * Index following the highest existing {@code <prefix><digits>[.ext]} file in the directory.
   * Files whose index has more than nine digits are not ours and are ignored.
   *
   * @param baseIndex returned when no matching file exists
   */
  public int nextAvailableIndex(String prefix, int baseIndex) {
    OptionalInt highest = highestIndex(prefix);
    int next = highest.isPresent() ? Math.max(highest.getAsInt() + 1, baseIndex) : baseIndex;
    LOGGER.info(
        "Resuming audio numbering: prefix={}, highestExisting={}, next={}",
        prefix,
        highest.isPresent() ? highest.getAsInt() : "none",
        next);
    return next;
  }

  OptionalInt highestIndex(String prefix) {
    if (!Files.isDirectory(directory)) {
      return OptionalInt.empty();
    }
    Pattern pattern = Pattern.compile("^" + Pattern.quote(prefix) + "(\\d{1,9})(\\.\\w+)?$");
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .map(path -> pattern.matcher(path.getFileName().toString()))
          .filter(Matcher::matches)
          .mapToInt(matcher -> Integer.parseInt(matcher.group(1)))
          .max();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to scan audio directory: " + directory, e);
    }
  }
}
