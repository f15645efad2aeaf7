package com.scholary.vocab.term;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TermTest {

  @Test
  void constructor_shouldTrimTextAndDefaultNotes() {
    Term term = new Term("  Каша ", null);

    assertThat(term.text()).isEqualTo("Каша");
    assertThat(term.notes()).isEmpty();
  }

  @Test
  void constructor_shouldRejectBlankText() {
    assertThatThrownBy(() -> new Term("   ")).isInstanceOf(IllegalArgumentException.class);
  }
}
