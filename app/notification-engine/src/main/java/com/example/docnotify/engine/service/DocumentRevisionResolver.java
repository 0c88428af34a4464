package com.example.docnotify.engine.service;

import com.example.docnotify.engine.model.RevisionRecord;
import java.util.Optional;

public interface DocumentRevisionResolver {

  Optional<RevisionRecord> findRevisionById(String revisionId);
}
