package com.receiptly.backend.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.receiptly.backend.entities.Document;
import com.receiptly.backend.enums.DocumentStatus;
import com.receiptly.backend.enums.ReviewStatus;

public interface DocumentRepository extends JpaRepository<Document, UUID> {

    Optional<Document> findByIdAndOwnerId(UUID id, UUID ownerId);

    List<Document> findByOwnerIdOrderByUploadedAtDesc(UUID ownerId);

    @Query("""
            select d from Document d
            where d.ownerId = :ownerId
              and d.extractedFields.reviewStatus = :reviewStatus
              and d.extractedFields.taxonomyCorrected = true
              and d.extractedFields.vendorName is not null
            order by d.uploadedAt desc, d.id desc
            """)
    List<Document> findTaxonomyCorrections(
            @Param("ownerId") UUID ownerId,
            @Param("reviewStatus") ReviewStatus reviewStatus,
            Pageable pageable
    );

    @Query("""
            select d from Document d
            where d.ownerId = :ownerId
              and d.status = :status
              and d.extractedFields.reviewStatus = com.receiptly.backend.enums.ReviewStatus.PENDING
              and d.extractedFields.needsReview = true
            order by d.uploadedAt desc
            """)
    Page<Document> findReviewQueue(
            @Param("ownerId") UUID ownerId,
            @Param("status") DocumentStatus status,
            Pageable pageable
    );
}
