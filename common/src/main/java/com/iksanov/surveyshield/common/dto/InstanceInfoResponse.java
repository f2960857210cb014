package com.iksanov.surveyshield.common.dto;

import java.time.Instant;

/**
 * Body of {@code GET /admin/instance-info}.
 */
public record InstanceInfoResponse(String machineName, Instant timestamp, DssStatus dssStatus) {
}
