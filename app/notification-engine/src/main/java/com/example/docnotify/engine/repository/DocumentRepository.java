/*
 * Where: Notification engine data access
 * What: Reads the documents and document_revisions read models
 * Why: Revision and comment events reference documents that may have been deleted since
 */
package com.example.docnotify.engine.repository;

import com.example.docnotify.engine.model.DocumentRecord;
import com.example.docnotify.engine.model.RevisionRecord;
import com.example.docnotify.engine.model.RoomContext;
import com.example.docnotify.engine.service.DocumentResolver;
import com.example.docnotify.engine.service.DocumentRevisionResolver;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DocumentRepository implements DocumentResolver, DocumentRevisionResolver {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Optional<DocumentRecord> findDocumentById(String documentId) {
    final String sql =
        """
        SELECT document_id, room_id, draft
        FROM documents
        WHERE document_id = :documentId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("documentId", documentId);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new DocumentRecord(
                    rs.getString("document_id"), rs.getString("room_id"), roomContext(rs)))
        .stream()
        .findFirst();
  }

  @Override
  public Optional<RevisionRecord> findRevisionById(String revisionId) {
    final String sql =
        """
        SELECT revision_id, document_id, room_id, draft
        FROM document_revisions
        WHERE revision_id = :revisionId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("revisionId", revisionId);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new RevisionRecord(
                    rs.getString("revision_id"),
                    rs.getString("document_id"),
                    rs.getString("room_id"),
                    roomContext(rs)))
        .stream()
        .findFirst();
  }

  // documents outside of a room have no room context at all
  private RoomContext roomContext(ResultSet rs) throws SQLException {
    if (rs.getString("room_id") == null) {
      return null;
    }
    return new RoomContext(rs.getBoolean("draft"));
  }
}
