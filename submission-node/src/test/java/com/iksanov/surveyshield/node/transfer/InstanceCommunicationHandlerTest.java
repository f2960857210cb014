package com.iksanov.surveyshield.node.transfer;

import com.iksanov.surveyshield.common.codec.JsonCodec;
import com.iksanov.surveyshield.common.dto.*;
import com.iksanov.surveyshield.node.election.LeaderElector;
import com.iksanov.surveyshield.node.http.HttpResult;
import com.iksanov.surveyshield.node.persistence.SurveyCloser;
import com.iksanov.surveyshield.node.submission.DelayedSubmissionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class InstanceCommunicationHandlerTest {

    private static final String SECRET = "shared-secret";
    private final LeaderElector elector = mock(LeaderElector.class);
    private final DelayedSubmissionService service = mock(DelayedSubmissionService.class);
    private final SurveyCloser closer = mock(SurveyCloser.class);
    private InstanceCommunicationHandler handler;

    @BeforeEach
    void setUp() {
        when(elector.isLeader()).thenReturn(true);
        handler = new InstanceCommunicationHandler(SECRET, elector, service, closer);
    }

    private static byte[] json(InstanceCommunicationPayload payload) {
        return JsonCodec.encode(payload);
    }

    @Test
    @DisplayName("Missing or wrong secret is rejected with 401 before the body is read")
    void badSecretShouldBeUnauthorized() {
        byte[] garbage = "not json".getBytes(StandardCharsets.UTF_8);

        assertEquals(401, handler.handle(null, garbage).status());
        assertEquals(401, handler.handle("", garbage).status());
        assertEquals(401, handler.handle("shared-secreT", garbage).status());
        verifyNoInteractions(service, closer);
    }

    @Test
    @DisplayName("Malformed body with a valid secret is a 400")
    void malformedBodyShouldBeBadRequest() {
        assertEquals(400, handler.handle(SECRET, "{".getBytes(StandardCharsets.UTF_8)).status());
    }

    @Test
    @DisplayName("Non-leader answers 200 with an unsuccessful envelope")
    void nonLeaderShouldRefuse() {
        when(elector.isLeader()).thenReturn(false);

        HttpResult result = handler.handle(SECRET, json(InstanceCommunicationPayload.transfer("f:1", List.of())));

        assertEquals(200, result.status());
        assertFalse(((ServiceResult<?>) result.body()).successful());
        verifyNoInteractions(service);
    }

    @Test
    @DisplayName("NoOp is acknowledged")
    void noOpShouldBeAcknowledged() {
        HttpResult result = handler.handle(SECRET, json(InstanceCommunicationPayload.noOp("f:1")));

        assertEquals(200, result.status());
        assertTrue(((ServiceResult<?>) result.body()).successful());
    }

    @Test
    @DisplayName("Transferred records are folded in and counted; an empty list counts zero")
    void transferShouldBeQueued() {
        UUID survey = UUID.randomUUID();
        List<PendingResponse> records = List.of(PendingResponse.of(survey, 1, QuestionType.RATING, "2").withDiscrepancy(-1.5));
        when(service.queueTransferredResponses(any())).thenAnswer(inv -> ((List<?>) inv.getArgument(0)).size());

        ServiceResult<?> accepted = (ServiceResult<?>) handler.handle(SECRET, json(InstanceCommunicationPayload.transfer("f:1", records))).body();
        ServiceResult<?> empty = (ServiceResult<?>) handler.handle(SECRET, json(InstanceCommunicationPayload.transfer("f:1", List.of()))).body();

        assertTrue(accepted.successful());
        assertEquals(1, accepted.data());
        assertTrue(empty.successful());
        assertEquals(0, empty.data());
        verify(service).queueTransferredResponses(records);
    }

    @Test
    @DisplayName("Close request without survey id fails, with id it is delegated")
    void closeSurveyShouldDelegate() {
        UUID survey = UUID.randomUUID();
        when(closer.closeSurvey(survey)).thenReturn(ServiceResult.success(true, "Survey closed successfully"));

        ServiceResult<?> missing = (ServiceResult<?>) handler.handle(SECRET,
                json(new InstanceCommunicationPayload("f:1", CommunicationType.CLOSE_SURVEY, null, null))).body();
        ServiceResult<?> closed = (ServiceResult<?>) handler.handle(SECRET, json(InstanceCommunicationPayload.closeSurvey("f:1", survey))).body();

        assertFalse(missing.successful());
        assertTrue(closed.successful());
        verify(closer, times(1)).closeSurvey(survey);
    }
}
