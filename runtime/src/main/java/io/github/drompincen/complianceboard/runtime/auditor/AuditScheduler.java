package io.github.drompincen.complianceboard.runtime.auditor;

import io.github.drompincen.complianceboard.protocol.api.ApiResult;
import io.github.drompincen.complianceboard.protocol.api.AuditReportDto;
import io.github.drompincen.complianceboard.protocol.api.AuditorDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Runs active auditors whose cron schedule has come due. Starting a run moves the auditor's next run time
 * forward, so a due auditor is picked up once per fire time.
 */
@Component
public class AuditScheduler {

    private static final Logger log = LoggerFactory.getLogger(AuditScheduler.class);

    private final AuditorService auditorService;
    private final AuditRunService auditRunService;

    public AuditScheduler(AuditorService auditorService, AuditRunService auditRunService) {
        this.auditorService = auditorService;
        this.auditRunService = auditRunService;
    }

    @Scheduled(fixedDelayString = "${complianceboard.auditors.scheduler-interval-ms:60000}")
    public void runDueAuditors() {
        runDueAuditors(auditorService.now());
    }

    public int runDueAuditors(Instant now) {
        List<AuditorDto> due = auditorService.dueAuditors(now);
        int started = 0;
        for (AuditorDto auditor : due) {
            try {
                ApiResult<AuditReportDto> result = auditRunService.run(auditor.projectId(), auditor.id(),
                        AuditReportDto.Trigger.SCHEDULED);
                if (result.success()) {
                    started++;
                    log.info("Scheduled run of auditor {} in project {}", auditor.id(), auditor.projectId());
                } else {
                    auditorService.skipToNextRun(auditor.projectId(), auditor.id(), now);
                    log.warn("Skipped scheduled run of auditor {}: {}", auditor.id(), result.error());
                }
            } catch (Exception e) {
                log.error("Failed to trigger scheduled auditor {}", auditor.id(), e);
            }
        }
        return started;
    }
}
