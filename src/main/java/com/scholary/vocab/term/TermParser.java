package com.scholary.vocab.term;

import com.scholary.vocab.config.PipelineProperties;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reads vocabulary lists into an ordered sequence of distinct terms.
 *
 * <p>Input format:
 *
 * <pre>
 * # Food            (comment, ignored; optionally becomes the notes of following terms)
 * Каша
 * Земля, Мир        (split into two terms under CommaPolicy.SPLIT)
 *
 * Твёрдый знак
 * </pre>
 *
 * <p>The returned streams are lazy: lines are read as terms are consumed. Each call to {@link
 * #parse(Path)} opens the file again, so a source can be parsed any number of times. Streams over
 * files must be closed.
 */
@Component
public class TermParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(TermParser.class);

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final CommaPolicy commaPolicy;
  private final boolean sectionNotes;

  @Autowired
  public TermParser(PipelineProperties properties) {
    this(properties.commaPolicy(), properties.sectionNotes());
  }

  public TermParser(CommaPolicy commaPolicy, boolean sectionNotes) {
    this.commaPolicy = commaPolicy;
    this.sectionNotes = sectionNotes;
  }

  public TermParser(CommaPolicy commaPolicy) {
    this(commaPolicy, false);
  }

  /**
   * Parse a UTF-8 vocabulary file.
   *
   * @param source the file to read
   * @return a lazy stream of distinct terms in first-occurrence order; close it when done
   * @throws InputFormatException if the file cannot be opened, read or decoded
   */
  public Stream<Term> parse(Path source) {
    BufferedReader reader;
    try {
      reader = Files.newBufferedReader(source, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new InputFormatException("Cannot open vocabulary file: " + source, e);
    }
    LOGGER.debug("Parsing vocabulary file: {}", source);
    return parse(reader)
        .onClose(
            () -> {
              try {
                reader.close();
              } catch (IOException e) {
                throw new UncheckedIOException(e);
              }
            });
  }

  /**
   * Parse vocabulary text from a reader.
   *
   * @throws InputFormatException (while the stream is consumed) if reading or decoding fails
   */
  public Stream<Term> parse(Reader source) {
    BufferedReader reader =
        source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);

    Set<String> seen = new HashSet<>();
    String[] section = {""};

    return lines(reader)
        .flatMap(line -> toTerms(line, section))
        .filter(term -> seen.add(term.text()));
  }

  /**
   * Parse a whole file eagerly.
   *
   * @return distinct terms in first-occurrence order
   */
  public List<Term> parseAll(Path source) {
    try (Stream<Term> terms = parse(source)) {
      return terms.collect(Collectors.toList());
    }
  }

  private Stream<Term> toTerms(String rawLine, String[] section) {
    String line = rawLine;
    if (!line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
      line = line.substring(1);
    }
    line = line.strip();

    if (line.isEmpty()) {
      return Stream.empty();
    }
    if (line.charAt(0) == '#') {
      if (sectionNotes) {
        section[0] = line.substring(1).strip();
      }
      return Stream.empty();
    }

    String notes = section[0];
    if (commaPolicy == CommaPolicy.SINGLE) {
      return Stream.of(new Term(line, notes));
    }
    return Arrays.stream(line.split(","))
        .map(String::strip)
        .filter(variant -> !variant.isEmpty())
        .map(variant -> new Term(variant, notes));
  }

  /** Lines of the reader, with read and decode failures reported as InputFormatException. */
  private static Stream<String> lines(BufferedReader reader) {
    Iterator<String> delegate = reader.lines().iterator();
    Iterator<String> guarded =
        new Iterator<>() {
          @Override
          public boolean hasNext() {
            try {
              return delegate.hasNext();
            } catch (UncheckedIOException e) {
              throw new InputFormatException(
                  "Vocabulary source is not readable UTF-8 text", e.getCause());
            }
          }

          @Override
          public String next() {
            try {
              return delegate.next();
            } catch (UncheckedIOException e) {
              throw new InputFormatException(
                  "Vocabulary source is not readable UTF-8 text", e.getCause());
            }
          }
        };
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(guarded, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }
}
