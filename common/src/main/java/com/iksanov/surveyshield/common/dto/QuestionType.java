package com.iksanov.surveyshield.common.dto;

public enum QuestionType {
    TEXT,
    RATING,
    SINGLE_CHOICE,
    MULTIPLE_CHOICE
}
