package com.iksanov.surveyshield.common.dto;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Body of {@code POST /api/internal/responses/transfer}.
 *
 * @param sourceInstanceId  instance id ({@code host:port}) of the sender
 * @param communicationType requested operation
 * @param responses         records to fold into the leader's queue, used by TRANSFER_RESPONSES
 * @param surveyId          survey to close, used by CLOSE_SURVEY
 */
public record InstanceCommunicationPayload(String sourceInstanceId, CommunicationType communicationType,
                                           List<PendingResponse> responses, UUID surveyId) {

    public InstanceCommunicationPayload {
        Objects.requireNonNull(communicationType, "communicationType");
        responses = responses == null ? List.of() : List.copyOf(responses);
    }

    public static InstanceCommunicationPayload noOp(String sourceInstanceId) {
        return new InstanceCommunicationPayload(sourceInstanceId, CommunicationType.NO_OP, List.of(), null);
    }

    public static InstanceCommunicationPayload transfer(String sourceInstanceId, List<PendingResponse> responses) {
        return new InstanceCommunicationPayload(sourceInstanceId, CommunicationType.TRANSFER_RESPONSES, responses, null);
    }

    public static InstanceCommunicationPayload closeSurvey(String sourceInstanceId, UUID surveyId) {
        return new InstanceCommunicationPayload(sourceInstanceId, CommunicationType.CLOSE_SURVEY, List.of(), surveyId);
    }
}
