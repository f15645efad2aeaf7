package com.scholary.vocab.table;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.vocab.record.FlashcardRecord;
import com.scholary.vocab.term.Term;
import com.scholary.vocab.translation.TranslationResult;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TableWriterTest {

  @TempDir Path tempDir;

  private final TableWriter writer = new TableWriter();

  private final List<FlashcardRecord> records =
      List.of(
          new FlashcardRecord(
              new Term("Каша"), new TranslationResult("Kasha", "Porridge"), "RT_VOCAB0001.mp3", ""),
          new FlashcardRecord(
              new Term("Мир"), new TranslationResult("Mir", "Peace"), "RT_VOCAB0002.mp3", "noun"));

  @Test
  void render_shouldWriteOneRowPerRecordInOrder() {
    String table = writer.render(records);

    assertThat(table)
        .isEqualTo(
            "Каша;Kasha;[sound:RT_VOCAB0001.mp3];Porridge;\n"
                + "Мир;Mir;[sound:RT_VOCAB0002.mp3];Peace;noun\n");
  }

  @Test
  void render_shouldPrependImportHeader() {
    String table = writer.render(records.subList(0, 1), new ImportHeader("Vocab", "Russian::Words"));

    assertThat(table)
        .startsWith(
            "#separator:Semicolon\n#html:false\n#notetype:Vocab\n#deck:Russian::Words\nКаша;");
  }

  @Test
  void render_shouldOmitHeaderWhenNothingConfigured() {
    assertThat(writer.render(records, new ImportHeader("", null))).startsWith("Каша;");
  }

  @Test
  void render_shouldRejectSeparatorInField() {
    List<FlashcardRecord> unsafe =
        List.of(
            new FlashcardRecord(
                new Term("Каша"), new TranslationResult("", "Porridge; oatmeal"), "a.mp3", ""));

    assertThatThrownBy(() -> writer.render(unsafe))
        .isInstanceOf(UnsafeFieldValueException.class)
        .hasMessageContaining("translated");
  }

  @Test
  void validate_shouldRejectLineBreaks() {
    assertThatThrownBy(() -> writer.validate("Каша", "", "Porridge", "line\r\nbreak"))
        .isInstanceOfSatisfying(
            UnsafeFieldValueException.class, e -> assertThat(e.getField()).isEqualTo("notes"));
  }

  @Test
  void render_shouldProduceEmptyTableForNoRecords() {
    assertThat(writer.render(List.of())).isEmpty();
  }

  @Test
  void write_shouldReplaceExistingFile() throws Exception {
    Path output = tempDir.resolve("out").resolve("vocab.csv");
    Files.createDirectories(output.getParent());
    Files.writeString(output, "stale content\n");

    writer.write(records, output);

    assertThat(Files.readString(output, StandardCharsets.UTF_8)).isEqualTo(writer.render(records));
    try (var files = Files.list(output.getParent())) {
      assertThat(files).containsExactly(output);
    }
  }

  @Test
  void write_shouldLeaveExistingFileWhenRecordIsUnsafe() throws Exception {
    Path output = tempDir.resolve("vocab.csv");
    Files.writeString(output, "previous\n");
    List<FlashcardRecord> unsafe =
        List.of(
            new FlashcardRecord(
                new Term("Каша"), new TranslationResult("", "Porridge\n"), "a.mp3", ""));

    assertThatThrownBy(() -> writer.write(unsafe, output))
        .isInstanceOf(UnsafeFieldValueException.class);
    assertThat(Files.readString(output)).isEqualTo("previous\n");
  }
}
