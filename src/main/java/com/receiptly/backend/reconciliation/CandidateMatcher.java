package com.receiptly.backend.reconciliation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.receiptly.backend.config.ReconciliationProperties;
import com.receiptly.backend.entities.LedgerTransaction;
import com.receiptly.backend.enums.ReconciliationStatus;
import com.receiptly.backend.enums.TransactionSource;
import com.receiptly.backend.exceptions.BadRequestException;
import com.receiptly.backend.exceptions.ConflictException;
import com.receiptly.backend.exceptions.ResourceNotFoundException;
import com.receiptly.backend.repositories.LedgerTransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Manual reconciliation of receipt drafts against the bank feed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CandidateMatcher {

    private static final double AMOUNT_SCORE_WEIGHT = 0.6;
    private static final double DATE_SCORE_WEIGHT = 0.4;

    private final LedgerTransactionRepository transactionRepository;
    private final ReconciliationProperties reconciliationProperties;

    /**
     * Unreconciled bank-feed transactions close to the draft in amount and date, best first.
     * Drafts already matched or ignored have no candidates.
     */
    @Transactional(readOnly = true)
    public List<Candidate> listCandidates(UUID ownerId, UUID draftId, Integer limit) {
        LedgerTransaction draft = loadDraft(ownerId, draftId);
        return findCandidates(draft, resolveLimit(limit));
    }

    @Transactional
    public LedgerTransaction ignoreCandidate(UUID ownerId, UUID draftId, UUID candidateId) {
        LedgerTransaction draft = loadDraft(ownerId, draftId);
        loadCandidate(ownerId, candidateId);
        if (draft.getReconciliationStatus() == ReconciliationStatus.MATCHED) {
            throw new ConflictException("Draft is already matched");
        }

        if (draft.getIgnoredCandidateIds().add(candidateId.toString())) {
            draft = transactionRepository.save(draft);
            log.info("[Reconciliation] Draft {} ignores candidate {}", draftId, candidateId);
        }
        return draft;
    }

    /**
     * Links the draft and the candidate and marks both MATCHED. Accepting the same pair again
     * changes nothing.
     *
     * @throws ConflictException when either side is already matched to something else, including
     *         by a concurrent accept that committed first
     */
    @Transactional
    public LedgerTransaction acceptCandidate(UUID ownerId, UUID draftId, UUID candidateId) {
        LedgerTransaction draft = loadDraft(ownerId, draftId);
        LedgerTransaction candidate = loadCandidate(ownerId, candidateId);

        boolean draftMatched = draft.getReconciliationStatus() == ReconciliationStatus.MATCHED;
        boolean candidateMatched = candidate.getReconciliationStatus() == ReconciliationStatus.MATCHED;

        if (draftMatched && !Objects.equals(draft.getMatchedTransactionId(), candidateId)) {
            throw new ConflictException("Draft is already matched to another transaction");
        }
        if (candidateMatched && !Objects.equals(candidate.getMatchedTransactionId(), draftId)) {
            throw new ConflictException("Transaction is already matched to another draft");
        }
        if (draftMatched && candidateMatched) {
            return draft;
        }

        draft.setReconciliationStatus(ReconciliationStatus.MATCHED);
        draft.setMatchedTransactionId(candidateId);
        draft.getIgnoredCandidateIds().remove(candidateId.toString());
        candidate.setReconciliationStatus(ReconciliationStatus.MATCHED);
        candidate.setMatchedTransactionId(draftId);

        LedgerTransaction savedDraft;
        try {
            savedDraft = transactionRepository.save(draft);
            transactionRepository.saveAndFlush(candidate);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn("[Reconciliation] Concurrent update while matching draft {} with transaction {}", draftId, candidateId);
            throw new ConflictException("Draft or transaction was changed concurrently; reload and retry");
        }
        log.info("[Reconciliation] Matched draft {} with transaction {}", draftId, candidateId);
        return savedDraft;
    }

    /**
     * Marks a draft as standing on its own (no bank counterpart expected).
     */
    @Transactional
    public LedgerTransaction ignoreDraft(UUID ownerId, UUID draftId) {
        LedgerTransaction draft = loadDraft(ownerId, draftId);
        if (draft.getReconciliationStatus() == ReconciliationStatus.MATCHED) {
            throw new ConflictException("Draft is already matched");
        }
        if (draft.getReconciliationStatus() != ReconciliationStatus.IGNORED) {
            draft.setReconciliationStatus(ReconciliationStatus.IGNORED);
            draft = transactionRepository.save(draft);
            log.info("[Reconciliation] Draft {} ignored", draftId);
        }
        return draft;
    }

    /**
     * Unreconciled drafts, newest first, each with its top candidates.
     * The offset is rounded down to a multiple of the limit.
     */
    @Transactional(readOnly = true)
    public Page<DraftCandidates> listUnmatchedDrafts(UUID ownerId, Integer limit, Integer offset, Integer candidateLimit) {
        int size = resolvePageSize(limit);
        int start = offset == null || offset < 0 ? 0 : offset;
        int perDraft = resolveLimit(candidateLimit);

        Page<LedgerTransaction> drafts = transactionRepository
                .findByOwnerIdAndSourceAndReconciliationStatusOrderByTransactionDateDesc(
                        ownerId,
                        TransactionSource.RECEIPT_DRAFT,
                        ReconciliationStatus.UNRECONCILED,
                        PageRequest.of(start / size, size)
                );
        return drafts.map(d -> new DraftCandidates(d, findCandidates(d, perDraft)));
    }

    List<Candidate> findCandidates(LedgerTransaction draft, int limit) {
        if (draft.getReconciliationStatus() != ReconciliationStatus.UNRECONCILED) {
            return List.of();
        }
        if (draft.getAmount() == null || draft.getTransactionDate() == null) {
            return List.of();
        }

        int windowDays = Math.max(0, reconciliationProperties.getDateWindowDays());
        BigDecimal tolerance = amountTolerance(draft.getAmount());

        List<LedgerTransaction> inWindow = transactionRepository.findUnreconciledInWindow(
                draft.getOwnerId(),
                TransactionSource.BANK_FEED,
                draft.getTransactionDate().minusDays(windowDays),
                draft.getTransactionDate().plusDays(windowDays)
        );

        return inWindow.stream()
                .filter(t -> !t.getId().equals(draft.getId()))
                .filter(t -> !draft.getIgnoredCandidateIds().contains(t.getId().toString()))
                .filter(t -> t.getAmount() != null && t.getAmount().signum() == draft.getAmount().signum())
                .map(t -> toCandidate(draft, t, tolerance, windowDays))
                .filter(c -> c.amountDelta().abs().compareTo(tolerance) <= 0)
                .sorted(Comparator
                        .comparing((Candidate c) -> c.amountDelta().abs())
                        .thenComparingLong(c -> Math.abs(c.dayDelta()))
                        .thenComparing(c -> c.transaction().getId().toString()))
                .limit(limit)
                .toList();
    }

    BigDecimal amountTolerance(BigDecimal draftAmount) {
        BigDecimal relative = draftAmount.abs()
                .multiply(reconciliationProperties.getAmountTolerance())
                .setScale(2, RoundingMode.HALF_UP);
        return relative.max(reconciliationProperties.getMinAmountTolerance());
    }

    private static Candidate toCandidate(LedgerTransaction draft, LedgerTransaction t, BigDecimal tolerance, int windowDays) {
        BigDecimal amountDelta = t.getAmount().subtract(draft.getAmount());
        long dayDelta = ChronoUnit.DAYS.between(draft.getTransactionDate(), t.getTransactionDate());

        double amountPart = tolerance.signum() == 0
                ? 0.0
                : amountDelta.abs().doubleValue() / tolerance.doubleValue();
        double datePart = windowDays == 0 ? 0.0 : (double) Math.abs(dayDelta) / windowDays;
        double score = 1.0 - AMOUNT_SCORE_WEIGHT * Math.min(amountPart, 1.0) - DATE_SCORE_WEIGHT * Math.min(datePart, 1.0);
        score = Math.round(Math.max(0.0, score) * 1000.0) / 1000.0;

        return new Candidate(t, amountDelta, dayDelta, score);
    }

    private LedgerTransaction loadDraft(UUID ownerId, UUID draftId) {
        LedgerTransaction draft = transactionRepository.findByIdAndOwnerId(draftId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Draft transaction not found"));
        if (draft.getSource() != TransactionSource.RECEIPT_DRAFT) {
            throw new BadRequestException("Transaction " + draftId + " is not a receipt draft");
        }
        return draft;
    }

    private LedgerTransaction loadCandidate(UUID ownerId, UUID candidateId) {
        LedgerTransaction candidate = transactionRepository.findByIdAndOwnerId(candidateId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Candidate transaction not found"));
        if (candidate.getSource() != TransactionSource.BANK_FEED) {
            throw new BadRequestException("Transaction " + candidateId + " is not a bank-feed transaction");
        }
        return candidate;
    }

    private int resolveLimit(Integer limit) {
        int max = reconciliationProperties.getMaxCandidateLimit();
        if (limit == null || limit <= 0) return Math.min(reconciliationProperties.getCandidateLimit(), max);
        return Math.min(limit, max);
    }

    private static int resolvePageSize(Integer limit) {
        if (limit == null || limit <= 0) return 20;
        return Math.min(limit, 100);
    }
}
