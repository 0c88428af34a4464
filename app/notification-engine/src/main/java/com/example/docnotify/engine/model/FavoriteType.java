package com.example.docnotify.engine.model;

public enum FavoriteType {
  ROOM("room"),
  DOCUMENT("document"),
  USER("user");

  private final String value;

  FavoriteType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static FavoriteType fromValue(String value) {
    for (FavoriteType type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unsupported favorite type: " + value);
  }
}
