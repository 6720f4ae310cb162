package com.scholary.dubber.voice;

public enum Gender {
  FEMALE,
  MALE,
  NEUTRAL
}
