package com.receiptly.backend.reconciliation;

import java.util.List;

import com.receiptly.backend.entities.LedgerTransaction;

public record DraftCandidates(LedgerTransaction draft, List<Candidate> candidates) {
}
