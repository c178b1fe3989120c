package com.example.matching.api;

public class UserAlreadyExistsException extends RuntimeException {

  public UserAlreadyExistsException() {
    super("user profile already exists");
  }
}
