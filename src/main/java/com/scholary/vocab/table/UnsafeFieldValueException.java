package com.scholary.vocab.table;

/** A field value would corrupt the delimited table: it contains the separator or a line break. */
public class UnsafeFieldValueException extends RuntimeException {

  private final String field;

  public UnsafeFieldValueException(String field, String value) {
    super(String.format("Field '%s' contains a separator or line break: %s", field, value));
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
