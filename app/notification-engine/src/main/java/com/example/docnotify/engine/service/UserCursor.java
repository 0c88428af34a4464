package com.example.docnotify.engine.service;

import com.example.docnotify.engine.model.UserRecord;
import java.util.Iterator;

/** Lazy sequence of users that may hold store resources until closed. Closing twice is a no-op. */
public interface UserCursor extends Iterator<UserRecord>, AutoCloseable {

  @Override
  void close();
}
