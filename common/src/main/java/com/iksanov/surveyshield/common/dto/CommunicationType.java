package com.iksanov.surveyshield.common.dto;

/**
 * Operations carried by the inter-instance transfer endpoint.
 */
public enum CommunicationType {
    /** Connectivity check made by followers on startup. */
    NO_OP,
    TRANSFER_RESPONSES,
    CLOSE_SURVEY
}
