package com.flamingo.ai.docpipeline.storage;

import java.util.UUID;

/** Builds storage locators keyed by document id. */
public final class StorageLocators {

  static final String PREFIX = "documents";
  private static final int MAX_NAME_LENGTH = 120;

  private StorageLocators() {}

  /** Returns {@code documents/<id>/<sanitized file name>}. */
  public static String forDocument(UUID documentId, String fileName) {
    if (documentId == null) {
      throw new IllegalArgumentException("documentId is required");
    }
    return PREFIX + "/" + documentId + "/" + sanitize(fileName);
  }

  static String sanitize(String fileName) {
    if (fileName == null || fileName.isBlank()) {
      return "content.bin";
    }
    String safe = fileName.replaceAll("[^a-zA-Z0-9.\\-_]", "_");
    if (safe.chars().allMatch(c -> c == '.')) {
      safe = "content.bin";
    }
    return safe.length() > MAX_NAME_LENGTH ? safe.substring(safe.length() - MAX_NAME_LENGTH) : safe;
  }
}
