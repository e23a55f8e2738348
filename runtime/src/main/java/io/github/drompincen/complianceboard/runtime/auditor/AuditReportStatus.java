package io.github.drompincen.complianceboard.runtime.auditor;

import io.github.drompincen.complianceboard.protocol.api.AuditReportDto;

import java.util.Locale;

/** Display state of an audit report. Any status string is legal; unknown ones map to {@link #OTHER}. */
public enum AuditReportStatus {
    PASSED, FAILED, RUNNING, OTHER;

    public static AuditReportStatus of(String status) {
        if (status == null) return OTHER;
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case AuditReportDto.STATUS_PASSED -> PASSED;
            case AuditReportDto.STATUS_FAILED -> FAILED;
            case AuditReportDto.STATUS_RUNNING -> RUNNING;
            default -> OTHER;
        };
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
