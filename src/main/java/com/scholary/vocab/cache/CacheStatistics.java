package com.scholary.vocab.cache;

/** Implemented by caching gateways so a run can report how many calls it saved. */
public interface CacheStatistics {

  /** Number of lookups served from the cache since startup. */
  long hitCount();
}
