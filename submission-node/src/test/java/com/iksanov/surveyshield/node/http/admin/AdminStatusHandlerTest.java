package com.iksanov.surveyshield.node.http.admin;

import com.iksanov.surveyshield.common.dto.DssStatus;
import com.iksanov.surveyshield.common.dto.InstanceInfoResponse;
import com.iksanov.surveyshield.common.dto.ServiceResult;
import com.iksanov.surveyshield.node.http.HttpResult;
import com.iksanov.surveyshield.node.persistence.SurveyCloser;
import com.iksanov.surveyshield.node.submission.DelayedSubmissionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AdminStatusHandlerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private final DelayedSubmissionService service = mock(DelayedSubmissionService.class);
    private final SurveyCloser closer = mock(SurveyCloser.class);
    private final AdminStatusHandler handler = new AdminStatusHandler(header -> "Bearer ok".equals(header), service, closer,
            Clock.fixed(NOW, ZoneOffset.UTC), "host-1");
    private final UUID survey = UUID.randomUUID();

    @Test
    @DisplayName("Instance info returns machine name, time and status to admins only")
    void instanceInfoShouldRequireAdmin() {
        DssStatus status = new DssStatus(2, null, null, 0, 30, false, true, "host-1:8080", true);
        when(service.status()).thenReturn(status);

        assertEquals(401, handler.instanceInfo("Bearer nope").status());
        HttpResult result = handler.instanceInfo("Bearer ok");

        assertEquals(200, result.status());
        assertEquals(new InstanceInfoResponse("host-1", NOW, status), result.body());
    }

    @Test
    @DisplayName("Flush rejects bad ids and reports storage failures as 500")
    void flushShouldValidateAndReport() {
        when(service.flushPendingResponses(survey)).thenReturn(ServiceResult.failure("Failed to persist pending responses"));

        assertEquals(401, handler.flushSurvey(null, survey.toString()).status());
        assertEquals(400, handler.flushSurvey("Bearer ok", "not-a-uuid").status());
        assertEquals(500, handler.flushSurvey("Bearer ok", survey.toString()).status());
        verify(service, times(1)).flushPendingResponses(any());
    }

    @Test
    @DisplayName("Flush on a follower is a 409 failure result, not a server error")
    void followerFlushShouldBeConflict() {
        ServiceResult<Integer> refused = ServiceResult.failure(DelayedSubmissionService.NOT_LEADER);
        when(service.flushPendingResponses(survey)).thenReturn(refused);
        when(service.forceFlushAllPendingResponses()).thenReturn(refused);

        HttpResult result = handler.flushSurvey("Bearer ok", survey.toString());

        assertEquals(409, result.status());
        assertFalse(((ServiceResult<?>) result.body()).successful());
        assertEquals(409, handler.forceFlushAll("Bearer ok").status());
    }

    @Test
    @DisplayName("Force flush is 403 while disabled and 200 once it persists")
    void forceFlushShouldFollowConfiguration() {
        when(service.forceFlushAllPendingResponses())
                .thenReturn(ServiceResult.failure(DelayedSubmissionService.FORCE_FLUSH_DISABLED))
                .thenReturn(ServiceResult.success(7, "Flushed 7 responses"));

        assertEquals(401, handler.forceFlushAll("Bearer nope").status());
        assertEquals(403, handler.forceFlushAll("Bearer ok").status());
        assertEquals(200, handler.forceFlushAll("Bearer ok").status());
        verify(service, times(2)).forceFlushAllPendingResponses();
    }

    @Test
    @DisplayName("Close delegates to the survey closer for admins only")
    void closeShouldDelegate() {
        when(closer.closeSurvey(survey)).thenReturn(ServiceResult.success(true, "Survey closed successfully"));

        assertEquals(401, handler.closeSurvey(null, survey.toString()).status());
        assertEquals(400, handler.closeSurvey("Bearer ok", "x").status());
        assertEquals(200, handler.closeSurvey("Bearer ok", survey.toString()).status());
        verify(closer, times(1)).closeSurvey(any());
    }
}
