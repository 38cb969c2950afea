package com.receiptly.backend.repositories;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.receiptly.backend.entities.LedgerTransaction;
import com.receiptly.backend.enums.ReconciliationStatus;
import com.receiptly.backend.enums.TransactionSource;

public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, UUID> {

    Optional<LedgerTransaction> findByIdAndOwnerId(UUID id, UUID ownerId);

    Optional<LedgerTransaction> findByOwnerIdAndProviderTransactionId(UUID ownerId, String providerTransactionId);

    Page<LedgerTransaction> findByOwnerIdAndSourceAndReconciliationStatusOrderByTransactionDateDesc(
            UUID ownerId,
            TransactionSource source,
            ReconciliationStatus reconciliationStatus,
            Pageable pageable
    );

    @Query("""
            select t from LedgerTransaction t
            where t.ownerId = :ownerId
              and t.source = :source
              and t.reconciliationStatus = com.receiptly.backend.enums.ReconciliationStatus.UNRECONCILED
              and t.transactionDate between :from and :to
            """)
    List<LedgerTransaction> findUnreconciledInWindow(
            @Param("ownerId") UUID ownerId,
            @Param("source") TransactionSource source,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to
    );
}
