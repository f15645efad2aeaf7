package com.scholary.vocab.cache;

import java.util.Optional;

/**
 * Cache of synthesized audio keyed by pronunciation script fingerprint.
 *
 * <p>The fingerprint covers the term, its translation, voices, prosody and gaps, so any change to
 * the drill produces a new key.
 */
public interface AudioCache {

  void put(String fingerprint, byte[] audio);

  Optional<byte[]> get(String fingerprint);
}
