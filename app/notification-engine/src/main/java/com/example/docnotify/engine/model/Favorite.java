package com.example.docnotify.engine.model;

public record Favorite(FavoriteType type, String id) {}
