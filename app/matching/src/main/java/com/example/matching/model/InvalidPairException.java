package com.example.matching.model;

public class InvalidPairException extends RuntimeException {

  public InvalidPairException(String message) {
    super(message);
  }
}
