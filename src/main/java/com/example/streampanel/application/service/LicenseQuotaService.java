package com.example.streampanel.application.service;

import com.example.streampanel.api.response.LicenseStatusResponse;
import com.example.streampanel.common.exception.BusinessException;
import com.example.streampanel.common.exception.ErrorCode;
import com.example.streampanel.domain.LicenseStatus;
import com.example.streampanel.domain.model.AdmissionDecision;
import com.example.streampanel.infrastructure.persistence.entity.LicenseEntity;
import com.example.streampanel.infrastructure.persistence.mapper.LicenseMapper;
import com.example.streampanel.infrastructure.persistence.mapper.StreamLogMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Connection slots per license key. Every change to {@code current_connections} is one
 * conditional UPDATE, so concurrent acquires cannot overshoot the cap and a release can
 * never drive the counter below zero.
 */
@Service
public class LicenseQuotaService {

    private static final Logger log = LoggerFactory.getLogger(LicenseQuotaService.class);

    private final LicenseMapper licenseMapper;
    private final StreamLogMapper streamLogMapper;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public LicenseQuotaService(LicenseMapper licenseMapper,
                               StreamLogMapper streamLogMapper,
                               Clock clock,
                               ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.licenseMapper = licenseMapper;
        this.streamLogMapper = streamLogMapper;
        this.clock = clock;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public AdmissionDecision acquire(String licenseKey) {
        if (!StringUtils.hasText(licenseKey)) {
            return AdmissionDecision.rejected(ErrorCode.LICENSE_INVALID, 0, 0);
        }
        String key = licenseKey.trim();
        LocalDateTime now = LocalDateTime.now(clock);
        if (licenseMapper.tryAcquire(key, now) == 1) {
            recordCounter("license.acquire", "result", "admitted");
            return AdmissionDecision.admitted();
        }

        LicenseEntity license = licenseMapper.selectByKey(key);
        if (!isUsable(license, now)) {
            log.warn("LICENSE_REJECTED reason=LICENSE_INVALID keyHash={}", summarizeKey(key));
            recordCounter("license.acquire", "result", "rejected", "reason", ErrorCode.LICENSE_INVALID.name());
            return AdmissionDecision.rejected(ErrorCode.LICENSE_INVALID, 0, 0);
        }
        long current = license.getCurrentConnections() == null ? 0L : license.getCurrentConnections();
        long max = license.getMaxConnections() == null ? 0L : license.getMaxConnections();
        log.warn("LICENSE_REJECTED reason=LICENSE_QUOTA_EXCEEDED keyHash={} current={} max={}",
                summarizeKey(key), current, max);
        recordCounter("license.acquire", "result", "rejected", "reason", ErrorCode.LICENSE_QUOTA_EXCEEDED.name());
        return AdmissionDecision.rejected(ErrorCode.LICENSE_QUOTA_EXCEEDED, current, max);
    }

    /**
     * Gives back one slot. Returns false when the counter was already zero or the key is
     * unknown.
     */
    public boolean release(String licenseKey) {
        if (!StringUtils.hasText(licenseKey)) {
            return false;
        }
        boolean released = licenseMapper.release(licenseKey.trim()) == 1;
        if (!released) {
            log.warn("LICENSE_RELEASE_NOOP keyHash={}", summarizeKey(licenseKey.trim()));
        }
        return released;
    }

    /**
     * Standalone validation for license-only clients: takes a slot or throws the rejection.
     */
    public LicenseStatusResponse validate(String licenseKey) {
        AdmissionDecision decision = acquire(licenseKey);
        if (!decision.isAdmitted()) {
            throw toException(decision);
        }
        return info(licenseKey);
    }

    /**
     * Gives back a slot taken by {@link #validate}. Slots held by open streams are not
     * touched here: the counter never drops below the number of open ledger rows on the key.
     */
    public LicenseStatusResponse disconnect(String licenseKey) {
        LicenseEntity license = requireLicense(licenseKey);
        String key = license.getLicenseKey();
        long streaming = streamLogMapper.countActiveByLicense(key);
        if (licenseMapper.releaseAbove(key, streaming) != 1) {
            log.warn("LICENSE_DISCONNECT_NOOP keyHash={} current={} streaming={}",
                    summarizeKey(key), license.getCurrentConnections(), streaming);
        }
        return info(key);
    }

    public LicenseStatusResponse info(String licenseKey) {
        return toResponse(requireLicense(licenseKey));
    }

    /**
     * Recomputes the counter from the ledger rows still open under this key. Repairs drift
     * left behind by clients that validated and never disconnected.
     */
    public LicenseStatusResponse reset(String licenseKey) {
        LicenseEntity license = requireLicense(licenseKey);
        long active = streamLogMapper.countActiveByLicense(license.getLicenseKey());
        int connections = (int) Math.min(Integer.MAX_VALUE, active);
        licenseMapper.resetConnections(license.getLicenseKey(), connections);
        log.info("LICENSE_RESET keyHash={} before={} after={}", summarizeKey(license.getLicenseKey()),
                license.getCurrentConnections(), connections);
        return info(license.getLicenseKey());
    }

    public LicenseStatusResponse revoke(String licenseKey) {
        LicenseEntity license = requireLicense(licenseKey);
        licenseMapper.revoke(license.getLicenseKey());
        log.info("LICENSE_REVOKED keyHash={}", summarizeKey(license.getLicenseKey()));
        return info(license.getLicenseKey());
    }

    public BusinessException toException(AdmissionDecision decision) {
        if (decision.getReason() == ErrorCode.LICENSE_QUOTA_EXCEEDED) {
            return new BusinessException(ErrorCode.LICENSE_QUOTA_EXCEEDED,
                    "Maximum connections reached (" + decision.getActiveCount() + "/" + decision.getLimit() + ")",
                    "Stop another stream on this license and try again");
        }
        return new BusinessException(ErrorCode.LICENSE_INVALID, "Invalid or expired license",
                "Check your license key");
    }

    private LicenseEntity requireLicense(String licenseKey) {
        LicenseEntity license = StringUtils.hasText(licenseKey) ? licenseMapper.selectByKey(licenseKey.trim()) : null;
        if (license == null) {
            throw new BusinessException(ErrorCode.LICENSE_NOT_FOUND, "License not found", "Check your license key");
        }
        return license;
    }

    private boolean isUsable(LicenseEntity license, LocalDateTime now) {
        if (license == null || LicenseStatus.fromStorage(license.getStatus()) != LicenseStatus.ACTIVE) {
            return false;
        }
        return license.getExpiresAt() == null || license.getExpiresAt().isAfter(now);
    }

    private LicenseStatusResponse toResponse(LicenseEntity license) {
        return new LicenseStatusResponse(
                license.getLicenseKey(),
                license.getCustomerName(),
                license.getPlanType(),
                LicenseStatus.fromStorage(license.getStatus()).name(),
                license.getMaxConnections(),
                license.getCurrentConnections(),
                license.getExpiresAt(),
                license.getLastUsed()
        );
    }

    private String summarizeKey(String key) {
        return "len=" + key.length() + ",hash=" + Integer.toHexString(key.hashCode());
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("License metric counter failed, name={}", name, ex);
        }
    }
}
