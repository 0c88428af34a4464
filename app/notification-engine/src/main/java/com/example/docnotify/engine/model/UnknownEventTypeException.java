package com.example.docnotify.engine.model;

public class UnknownEventTypeException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public UnknownEventTypeException(String type) {
    super("Event type " + type + " is unknown");
  }
}
