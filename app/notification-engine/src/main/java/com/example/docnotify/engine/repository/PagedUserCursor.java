/*
 * Where: Notification engine data access
 * What: Keyset-paged cursor over users
 * Why: Only one page of the user population is held in memory at a time
 */
package com.example.docnotify.engine.repository;

import com.example.docnotify.engine.model.UserRecord;
import com.example.docnotify.engine.service.UserCursor;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

final class PagedUserCursor implements UserCursor {

  private final Function<String, List<UserRecord>> pageLoader;
  private final int pageSize;
  private Iterator<UserRecord> page = Collections.emptyIterator();
  private String lastUserId = "";
  private boolean exhausted;
  private boolean closed;

  /**
   * @param pageLoader loads at most {@code pageSize} users ordered by id with an id greater than
   *     the argument
   */
  PagedUserCursor(Function<String, List<UserRecord>> pageLoader, int pageSize) {
    if (pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
    }
    this.pageLoader = pageLoader;
    this.pageSize = pageSize;
  }

  @Override
  public boolean hasNext() {
    if (closed) {
      return false;
    }
    while (!page.hasNext() && !exhausted) {
      loadNextPage();
    }
    return page.hasNext();
  }

  @Override
  public UserRecord next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return page.next();
  }

  @Override
  public void close() {
    closed = true;
    exhausted = true;
    page = Collections.emptyIterator();
  }

  boolean isClosed() {
    return closed;
  }

  private void loadNextPage() {
    final List<UserRecord> users = pageLoader.apply(lastUserId);
    if (users.size() < pageSize) {
      exhausted = true;
    }
    if (!users.isEmpty()) {
      lastUserId = users.get(users.size() - 1).userId();
    }
    page = users.iterator();
  }
}
