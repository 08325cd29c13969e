package com.flamingo.ai.docpipeline.storage;

/** Metadata captured at upload and stored next to the document bytes. */
public record StoredObjectMetadata(String fileName, String contentType, long sizeBytes) {}
