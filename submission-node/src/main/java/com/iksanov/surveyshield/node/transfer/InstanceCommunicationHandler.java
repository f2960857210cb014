package com.iksanov.surveyshield.node.transfer;

import com.iksanov.surveyshield.common.codec.JsonCodec;
import com.iksanov.surveyshield.common.dto.InstanceCommunicationPayload;
import com.iksanov.surveyshield.common.dto.ServiceResult;
import com.iksanov.surveyshield.common.exception.SerializationException;
import com.iksanov.surveyshield.common.util.SecretUtils;
import com.iksanov.surveyshield.node.election.LeaderElector;
import com.iksanov.surveyshield.node.http.HttpResult;
import com.iksanov.surveyshield.node.persistence.SurveyCloser;
import com.iksanov.surveyshield.node.submission.DelayedSubmissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Receiving side of {@code POST /api/internal/responses/transfer}.
 * The shared secret is checked before the body is parsed.
 */
public class InstanceCommunicationHandler {

    private static final Logger log = LoggerFactory.getLogger(InstanceCommunicationHandler.class);
    private final String instanceSecret;
    private final LeaderElector elector;
    private final DelayedSubmissionService submissionService;
    private final SurveyCloser surveyCloser;

    public InstanceCommunicationHandler(String instanceSecret, LeaderElector elector, DelayedSubmissionService submissionService, SurveyCloser surveyCloser) {
        this.instanceSecret = Objects.requireNonNull(instanceSecret, "instanceSecret");
        this.elector = Objects.requireNonNull(elector, "elector");
        this.submissionService = Objects.requireNonNull(submissionService, "submissionService");
        this.surveyCloser = Objects.requireNonNull(surveyCloser, "surveyCloser");
    }

    public HttpResult handle(String authHeader, byte[] body) {
        if (!SecretUtils.matches(authHeader, instanceSecret)) {
            log.warn("Rejected instance request with missing or invalid secret");
            return HttpResult.unauthorized();
        }

        InstanceCommunicationPayload payload;
        try {
            payload = JsonCodec.decode(body, InstanceCommunicationPayload.class);
        } catch (SerializationException e) {
            return HttpResult.badRequest("Malformed payload");
        }
        return HttpResult.ok(dispatch(payload));
    }

    ServiceResult<?> dispatch(InstanceCommunicationPayload payload) {
        if (!elector.isLeader()) {
            log.debug("Received {} from {} while not leader", payload.communicationType(), payload.sourceInstanceId());
            return ServiceResult.failure("This instance is not the leader");
        }

        return switch (payload.communicationType()) {
            case NO_OP -> ServiceResult.success(true, "Acknowledged");
            case TRANSFER_RESPONSES -> {
                int accepted = submissionService.queueTransferredResponses(payload.responses());
                log.info("Accepted {} responses from {}", accepted, payload.sourceInstanceId());
                yield ServiceResult.success(accepted, "Accepted " + accepted + " responses");
            }
            case CLOSE_SURVEY -> {
                if (payload.surveyId() == null) yield ServiceResult.failure("Survey id is required");
                yield surveyCloser.closeSurvey(payload.surveyId());
            }
        };
    }
}
