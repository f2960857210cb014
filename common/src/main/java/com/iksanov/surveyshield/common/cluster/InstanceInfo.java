package com.iksanov.surveyshield.common.cluster;

/**
 * Network identity of a running instance. The instance id is {@code host:port} and doubles as the
 * address other instances use to reach it.
 */
public record InstanceInfo(String host, int port) {

    public InstanceInfo {
        if (host == null || host.isBlank()) throw new IllegalArgumentException("host cannot be null or blank");
        if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range");
    }

    public static InstanceInfo fromInstanceId(String instanceId) {
        if (instanceId == null || instanceId.isBlank()) throw new IllegalArgumentException("instanceId cannot be null or blank");
        int idx = instanceId.lastIndexOf(':');
        if (idx <= 0 || idx == instanceId.length() - 1) {
            throw new IllegalArgumentException("Invalid instance id '" + instanceId + "'. Expected format: 'host:port'");
        }
        try {
            return new InstanceInfo(instanceId.substring(0, idx), Integer.parseInt(instanceId.substring(idx + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in instance id '" + instanceId + "'", e);
        }
    }

    public String instanceId() {
        return host + ":" + port;
    }

    @Override
    public String toString() {
        return "InstanceInfo[%s]".formatted(instanceId());
    }
}
