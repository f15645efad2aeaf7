package com.scholary.vocab.table;

import java.util.ArrayList;
import java.util.List;

/**
 * Directives Anki reads from the top of an imported text file.
 *
 * @param noteType note type to import into, or blank to let the user choose
 * @param deck target deck, or blank to let the user choose
 */
public record ImportHeader(String noteType, String deck) {

  public static final ImportHeader NONE = new ImportHeader(null, null);

  public boolean isEmpty() {
    return isBlank(noteType) && isBlank(deck);
  }

  List<String> lines() {
    if (isEmpty()) {
      return List.of();
    }
    List<String> lines = new ArrayList<>();
    lines.add("#separator:Semicolon");
    lines.add("#html:false");
    if (!isBlank(noteType)) {
      lines.add("#notetype:" + noteType);
    }
    if (!isBlank(deck)) {
      lines.add("#deck:" + deck);
    }
    return lines;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
