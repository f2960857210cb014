package com.iksanov.surveyshield.node.transfer;

import com.iksanov.surveyshield.common.dto.ServiceResult;
import com.iksanov.surveyshield.node.election.LeaderElector;
import com.iksanov.surveyshield.node.persistence.SurveyCloser;

import java.util.Objects;
import java.util.UUID;

/**
 * Closes locally on the leader and forwards a {@code CLOSE_SURVEY} request to it otherwise.
 */
public class LeaderRoutedSurveyCloser implements SurveyCloser {

    private final LeaderElector elector;
    private final SurveyCloser localCloser;
    private final TransferClient transferClient;

    public LeaderRoutedSurveyCloser(LeaderElector elector, SurveyCloser localCloser, TransferClient transferClient) {
        this.elector = Objects.requireNonNull(elector, "elector");
        this.localCloser = Objects.requireNonNull(localCloser, "localCloser");
        this.transferClient = Objects.requireNonNull(transferClient, "transferClient");
    }

    @Override
    public ServiceResult<Boolean> closeSurvey(UUID surveyId) {
        if (elector.isLeader()) return localCloser.closeSurvey(surveyId);
        return transferClient.requestSurveyClose(surveyId);
    }
}
