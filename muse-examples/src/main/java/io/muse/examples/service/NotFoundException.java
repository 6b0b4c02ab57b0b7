package io.muse.examples.service;

public final class NotFoundException extends RuntimeException {
  public NotFoundException(String message) {
    super(message);
  }
}
