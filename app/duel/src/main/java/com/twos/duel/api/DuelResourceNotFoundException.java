package com.twos.duel.api;

public class DuelResourceNotFoundException extends RuntimeException {

  public DuelResourceNotFoundException(String resource, Object id) {
    super(resource + " not found: " + id);
  }
}
