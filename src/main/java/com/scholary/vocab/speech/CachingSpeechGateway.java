package com.scholary.vocab.speech;

import com.scholary.vocab.cache.AudioCache;
import com.scholary.vocab.cache.CacheStatistics;
import com.scholary.vocab.script.PronunciationScript;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Speech gateway that reuses audio for scripts it has already rendered. */
public class CachingSpeechGateway implements SpeechGateway, CacheStatistics {

  private static final Logger LOGGER = LoggerFactory.getLogger(CachingSpeechGateway.class);

  private final SpeechGateway delegate;
  private final AudioCache cache;
  private final AtomicLong hits = new AtomicLong();

  public CachingSpeechGateway(SpeechGateway delegate, AudioCache cache) {
    this.delegate = delegate;
    this.cache = cache;
  }

  @Override
  public byte[] synthesize(PronunciationScript script) {
    String fingerprint = script.fingerprint();

    Optional<byte[]> cached = cache.get(fingerprint);
    if (cached.isPresent()) {
      hits.incrementAndGet();
      return cached.get();
    }

    byte[] audio = delegate.synthesize(script);
    cache.put(fingerprint, audio);
    LOGGER.debug(
        "Synthesized and cached: term={}, fingerprint={}, bytes={}",
        script.term().text(),
        fingerprint,
        audio.length);
    return audio;
  }

  @Override
  public long hitCount() {
    return hits.get();
  }
}
