package com.iksanov.surveyshield.node.election;

public record LeadershipState(String instanceId, boolean leader, boolean ready) {
}
