package com.example.docnotify.engine.model;

public enum ProcessingResult {
  SUCCEEDED,
  CANCELLED,
  FAILED
}
