package com.scholary.vocab.script;

/** Position of a voice in the pronunciation drill, in speaking order. */
public enum VoiceRole {
  NATIVE_A,
  NATIVE_B,
  TARGET
}
