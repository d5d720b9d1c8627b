package com.example.streampanel.application.service;

import com.example.streampanel.common.exception.BusinessException;
import com.example.streampanel.common.exception.ErrorCode;
import com.example.streampanel.domain.model.AdmissionDecision;
import com.example.streampanel.infrastructure.persistence.entity.AccountEntity;
import com.example.streampanel.infrastructure.persistence.mapper.AccountMapper;
import com.example.streampanel.infrastructure.persistence.mapper.StreamLogMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Per-account concurrent stream cap.
 * <p>
 * The active count is derived from the usage ledger (rows with no end time), never kept
 * as a separate counter. Count-then-insert runs under an in-process lock for the account
 * and inside a transaction that holds the account row lock, so two starts for one account
 * can never both see room for a single remaining slot.
 */
@Service
public class QuotaGuard {

    private static final Logger log = LoggerFactory.getLogger(QuotaGuard.class);

    private static final int LOCK_STRIPES = 64;

    private final AccountMapper accountMapper;
    private final StreamLogMapper streamLogMapper;
    private final TransactionOperations transactionOperations;
    private final MeterRegistry meterRegistry;
    private final ReentrantLock[] accountLocks = new ReentrantLock[LOCK_STRIPES];

    public QuotaGuard(AccountMapper accountMapper,
                      StreamLogMapper streamLogMapper,
                      TransactionOperations transactionOperations,
                      ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.accountMapper = accountMapper;
        this.streamLogMapper = streamLogMapper;
        this.transactionOperations = transactionOperations;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
        for (int i = 0; i < LOCK_STRIPES; i++) {
            accountLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Admits one more stream for {@code accountId} if it is under its cap. On admission
     * {@code onAdmitted} runs before the lock is released; an exception from it rolls the
     * admission back and propagates.
     */
    public AdmissionDecision admit(Long accountId, Runnable onAdmitted) {
        ReentrantLock lock = lockFor(accountId);
        lock.lock();
        try {
            AdmissionDecision decision = transactionOperations.execute(status -> {
                AccountEntity account = accountMapper.selectByIdForUpdate(accountId);
                if (account == null) {
                    throw new BusinessException(ErrorCode.AUTH_SESSION_INVALID, "User not found.",
                            "Please log in again");
                }
                long limit = account.getMaxConnections() == null ? 0L : account.getMaxConnections();
                long active = streamLogMapper.countActiveByUser(accountId);
                if (active >= limit) {
                    return AdmissionDecision.rejected(ErrorCode.QUOTA_EXCEEDED, active, limit);
                }
                onAdmitted.run();
                return AdmissionDecision.admitted();
            });
            if (decision == null) {
                throw new BusinessException(ErrorCode.INTERNAL_ERROR, "Admission produced no decision");
            }
            if (decision.isAdmitted()) {
                recordCounter("stream.admission", "result", "admitted");
            } else {
                log.warn("STREAM_QUOTA_REJECTED accountId={} active={} limit={}",
                        accountId, decision.getActiveCount(), decision.getLimit());
                recordCounter("stream.admission", "result", "rejected", "reason", ErrorCode.QUOTA_EXCEEDED.name());
            }
            return decision;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Accounts share a fixed set of locks. Two accounts on one stripe only serialize their
     * admissions; the row lock still decides per account.
     */
    private ReentrantLock lockFor(Long accountId) {
        int hash = accountId == null ? 0 : accountId.hashCode();
        return accountLocks[Math.floorMod(hash, LOCK_STRIPES)];
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("Quota metric counter failed, name={}", name, ex);
        }
    }
}
