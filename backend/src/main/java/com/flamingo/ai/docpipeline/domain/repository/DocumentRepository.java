package com.flamingo.ai.docpipeline.domain.repository;

import com.flamingo.ai.docpipeline.domain.entity.Document;
import com.flamingo.ai.docpipeline.domain.enums.DocumentStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/** Repository for Document entities. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  /** Finds all documents that have not been soft-deleted, newest first. */
  List<Document> findByDeletedFalseOrderByCreatedAtDesc();

  /** Finds active documents stuck in a status since before the cutoff. */
  List<Document> findByStatusAndDeletedFalseAndUpdatedAtBefore(
      DocumentStatus status, LocalDateTime cutoff);

  /** Counts active documents by status. */
  long countByStatusAndDeletedFalse(DocumentStatus status);

  /** Counts documents that have not been soft-deleted. */
  @Query("SELECT COUNT(d) FROM Document d WHERE d.deleted = false")
  long countActive();
}
