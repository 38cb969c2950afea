package com.receiptly.backend.reconciliation;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.receiptly.backend.entities.LedgerTransaction;
import com.receiptly.backend.repositories.LedgerTransactionRepository;

import lombok.RequiredArgsConstructor;

/**
 * Inserts a draft in its own transaction so a unique-constraint violation rolls back only the insert.
 */
@Component
@RequiredArgsConstructor
public class ReceiptDraftWriter {

    private final LedgerTransactionRepository transactionRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public LedgerTransaction insert(LedgerTransaction draft) {
        return transactionRepository.saveAndFlush(draft);
    }
}
