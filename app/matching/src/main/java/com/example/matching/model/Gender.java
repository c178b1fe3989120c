package com.example.matching.model;

public enum Gender {
  MALE("male"),
  FEMALE("female"),
  OTHER("other");

  private final String value;

  Gender(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static Gender fromValue(String value) {
    for (Gender gender : values()) {
      if (gender.value.equalsIgnoreCase(value)) {
        return gender;
      }
    }
    throw new IllegalArgumentException("unsupported gender: " + value);
  }
}
