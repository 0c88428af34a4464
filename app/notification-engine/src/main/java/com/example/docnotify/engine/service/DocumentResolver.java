package com.example.docnotify.engine.service;

import com.example.docnotify.engine.model.DocumentRecord;
import java.util.Optional;

public interface DocumentResolver {

  /** Empty when the document was deleted after the event was recorded. */
  Optional<DocumentRecord> findDocumentById(String documentId);
}
