package com.iksanov.surveyshield.node.persistence;

import com.iksanov.surveyshield.common.dto.ServiceResult;

import java.util.UUID;

/**
 * Closes a survey. Local implementations run on the leader.
 */
public interface SurveyCloser {

    ServiceResult<Boolean> closeSurvey(UUID surveyId);
}
