package com.twos.duel.api;

public class DuelAccessDeniedException extends RuntimeException {

  public DuelAccessDeniedException(String message) {
    super(message);
  }
}
