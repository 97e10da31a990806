package org.example.bookmarksync.model;

public record TargetCollection(String id, String name) {}
