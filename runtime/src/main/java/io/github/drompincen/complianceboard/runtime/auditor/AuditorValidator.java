package io.github.drompincen.complianceboard.runtime.auditor;

import io.github.drompincen.complianceboard.protocol.api.ApiResult;
import io.github.drompincen.complianceboard.protocol.api.AuditorInstructions;
import io.github.drompincen.complianceboard.protocol.api.AuditorRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks an auditor payload before it is sent anywhere. Whitespace-only criteria rows are stripped first; a
 * requirement left without a success or failure criterion rejects the whole payload.
 */
public final class AuditorValidator {

    private AuditorValidator() {}

    public static ApiResult<AuditorRequest> validateCreate(AuditorRequest request) {
        if (request == null) return ApiResult.failure("Invalid request");
        if (request.instructions() == null) return ApiResult.failure("Instructions are required");
        return normalize(request, true);
    }

    public static ApiResult<AuditorRequest> validateUpdate(AuditorRequest request) {
        if (request == null) return ApiResult.failure("Invalid request");
        return normalize(request, false);
    }

    /**
     * Returns the cleaned-up request, or the first problem found. On update only the fields that are present
     * are checked.
     */
    public static ApiResult<AuditorRequest> normalize(AuditorRequest request, boolean nameRequired) {
        String name = request.name() != null ? request.name().trim() : null;
        if ((nameRequired || name != null) && (name == null || name.isEmpty())) {
            return ApiResult.failure("Name is required");
        }

        String schedule = request.schedule();
        if (schedule != null) {
            Optional<String> scheduleError = AuditSchedule.validate(schedule);
            if (scheduleError.isPresent()) return ApiResult.failure(scheduleError.get());
            schedule = AuditSchedule.normalize(schedule);
        }

        AuditorInstructions instructions = request.instructions();
        if (instructions != null) {
            ApiResult<AuditorInstructions> checked = normalizeInstructions(instructions);
            if (!checked.success()) return ApiResult.failure(checked.error());
            instructions = checked.value();
        }

        return ApiResult.success(new AuditorRequest(name, request.description(), schedule, request.isActive(),
                request.documentId(), instructions));
    }

    public static ApiResult<AuditorInstructions> normalizeInstructions(AuditorInstructions instructions) {
        if (instructions.passingScore() < 0 || instructions.passingScore() > 100) {
            return ApiResult.failure("Passing score must be between 0 and 100");
        }
        List<AuditorInstructions.Requirement> requirements = instructions.requirements() != null
                ? instructions.requirements() : List.of();
        List<AuditorInstructions.Requirement> cleaned = new ArrayList<>(requirements.size());
        for (int i = 0; i < requirements.size(); i++) {
            AuditorInstructions.Requirement req = requirements.get(i);
            String title = req.title() != null ? req.title().trim() : "";
            String label = title.isEmpty() ? "#" + (i + 1) : title;
            if (title.isEmpty()) {
                return ApiResult.failure("Requirement " + label + " needs a title");
            }
            List<String> success = strip(req.successCriteria());
            List<String> failure = strip(req.failureCriteria());
            if (success.isEmpty()) {
                return ApiResult.failure("Requirement \"" + label + "\" needs at least one success criterion");
            }
            if (failure.isEmpty()) {
                return ApiResult.failure("Requirement \"" + label + "\" needs at least one failure criterion");
            }
            if (req.weight() < 0 || req.weight() > 100) {
                return ApiResult.failure("Requirement \"" + label + "\" weight must be between 0 and 100");
            }
            String id = req.id() != null && !req.id().isBlank() ? req.id() : "req-" + (i + 1);
            cleaned.add(new AuditorInstructions.Requirement(id, title, req.description(), req.context(),
                    success, failure, req.weight()));
        }
        return ApiResult.success(new AuditorInstructions(instructions.passingScore(), List.copyOf(cleaned),
                instructions.evaluationInstructions()));
    }

    private static List<String> strip(List<String> criteria) {
        if (criteria == null) return List.of();
        return criteria.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(String::trim)
                .toList();
    }
}
