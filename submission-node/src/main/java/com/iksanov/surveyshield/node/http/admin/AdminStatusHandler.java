package com.iksanov.surveyshield.node.http.admin;

import com.iksanov.surveyshield.common.dto.InstanceInfoResponse;
import com.iksanov.surveyshield.common.dto.ServiceResult;
import com.iksanov.surveyshield.node.http.HttpResult;
import com.iksanov.surveyshield.node.persistence.SurveyCloser;
import com.iksanov.surveyshield.node.submission.DelayedSubmissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

public class AdminStatusHandler {

    private static final Logger log = LoggerFactory.getLogger(AdminStatusHandler.class);
    private final AdminAuthenticator authenticator;
    private final DelayedSubmissionService submissionService;
    private final SurveyCloser surveyCloser;
    private final Clock clock;
    private final String machineName;

    public AdminStatusHandler(AdminAuthenticator authenticator, DelayedSubmissionService submissionService, SurveyCloser surveyCloser,
                              Clock clock, String machineName) {
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
        this.submissionService = Objects.requireNonNull(submissionService, "submissionService");
        this.surveyCloser = Objects.requireNonNull(surveyCloser, "surveyCloser");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.machineName = Objects.requireNonNull(machineName, "machineName");
    }

    public HttpResult instanceInfo(String authorizationHeader) {
        if (!authenticator.isAdmin(authorizationHeader)) return HttpResult.unauthorized();
        return HttpResult.ok(new InstanceInfoResponse(machineName, clock.instant(), submissionService.status()));
    }

    public HttpResult flushSurvey(String authorizationHeader, String rawSurveyId) {
        if (!authenticator.isAdmin(authorizationHeader)) return HttpResult.unauthorized();
        UUID surveyId = parseSurveyId(rawSurveyId);
        if (surveyId == null) return HttpResult.badRequest("Invalid survey id");
        log.info("Admin flush requested for survey {}", surveyId);
        return flushResult(submissionService.flushPendingResponses(surveyId));
    }

    /**
     * Debug-only flush of the whole queue. Refused with 403 unless force flush is enabled.
     */
    public HttpResult forceFlushAll(String authorizationHeader) {
        if (!authenticator.isAdmin(authorizationHeader)) return HttpResult.unauthorized();
        log.info("Admin force flush requested");
        return flushResult(submissionService.forceFlushAllPendingResponses());
    }

    public HttpResult closeSurvey(String authorizationHeader, String rawSurveyId) {
        if (!authenticator.isAdmin(authorizationHeader)) return HttpResult.unauthorized();
        UUID surveyId = parseSurveyId(rawSurveyId);
        if (surveyId == null) return HttpResult.badRequest("Invalid survey id");
        log.info("Admin close requested for survey {}", surveyId);
        ServiceResult<Boolean> result = surveyCloser.closeSurvey(surveyId);
        return new HttpResult(result.successful() ? 200 : 500, result);
    }

    // Refusals are 403/409 with successful=false; only storage faults are 500.
    private static HttpResult flushResult(ServiceResult<Integer> result) {
        if (result.successful()) return HttpResult.ok(result);
        if (DelayedSubmissionService.NOT_LEADER.equals(result.message())) return new HttpResult(409, result);
        if (DelayedSubmissionService.FORCE_FLUSH_DISABLED.equals(result.message())) return new HttpResult(403, result);
        return new HttpResult(500, result);
    }

    private static UUID parseSurveyId(String raw) {
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException | NullPointerException e) {
            return null;
        }
    }
}
