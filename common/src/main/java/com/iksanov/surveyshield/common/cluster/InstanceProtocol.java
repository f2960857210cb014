package com.iksanov.surveyshield.common.cluster;

/**
 * Wire constants shared by the instance-to-instance client and server.
 */
public final class InstanceProtocol {

    public static final String TRANSFER_PATH = "/api/internal/responses/transfer";
    public static final String AUTH_HEADER = "X-Instance-Auth";
    public static final String CONTENT_TYPE_JSON = "application/json";

    private InstanceProtocol() {
    }
}
