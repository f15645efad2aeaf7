package com.scholary.vocab.table;

import com.scholary.vocab.record.FlashcardRecord;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes flashcard records as a semicolon-delimited table for Anki import.
 *
 * <p>Row format, one record per line:
 *
 * <pre>
 * text;romanized;[sound:filename];translated;notes
 * </pre>
 *
 * <p>Fields are not quoted, so a value containing {@code ;} or a line break is refused rather than
 * written.
 */
@Component
public class TableWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TableWriter.class);

  static final char SEPARATOR = ';';

  public String render(List<FlashcardRecord> records) {
    return render(records, ImportHeader.NONE);
  }

  public String render(List<FlashcardRecord> records, ImportHeader header) {
    StringBuilder table = new StringBuilder();
    for (String line : header.lines()) {
      table.append(line).append('\n');
    }
    for (FlashcardRecord record : records) {
      table.append(row(record)).append('\n');
    }
    return table.toString();
  }

  public void write(List<FlashcardRecord> records, Path output) {
    write(records, output, ImportHeader.NONE);
  }

  /**
   * Render and write the table. The content lands in a temporary file first and is then moved
   * over {@code output}, so readers never see a half-written table.
   *
   * @throws UnsafeFieldValueException if any field is unsafe; nothing is written
   * @throws UncheckedIOException if the file cannot be written
   */
  public void write(List<FlashcardRecord> records, Path output, ImportHeader header) {
    String content = render(records, header);
    Path parent = output.toAbsolutePath().getParent();
    try {
      Files.createDirectories(parent);
      Path temp = Files.createTempFile(parent, output.getFileName().toString(), ".tmp");
      Files.writeString(temp, content, StandardCharsets.UTF_8);
      Files.move(temp, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write table: " + output, e);
    }
    LOGGER.info("Wrote {} records to {}", records.size(), output);
  }

  /**
   * Check the fields a row for this content would hold.
   *
   * @throws UnsafeFieldValueException naming the first unsafe field
   */
  public void validate(String text, String romanized, String translated, String notes) {
    checkField("text", text);
    checkField("romanized", romanized);
    checkField("translated", translated);
    checkField("notes", notes);
  }

  String row(FlashcardRecord record) {
    String text = record.term().text();
    String romanized = record.translation().romanized();
    String translated = record.translation().translated();
    validate(text, romanized, translated, record.notes());
    checkField("audio", record.audioFilename());

    return String.join(
        String.valueOf(SEPARATOR),
        text,
        romanized,
        "[sound:" + record.audioFilename() + "]",
        translated,
        record.notes());
  }

  private static void checkField(String field, String value) {
    if (value == null) {
      return;
    }
    if (value.indexOf(SEPARATOR) >= 0 || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
      throw new UnsafeFieldValueException(field, value);
    }
  }
}
