package com.iksanov.surveyshield.node.transfer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.iksanov.surveyshield.common.dto.InstanceCommunicationPayload;
import com.iksanov.surveyshield.common.dto.ServiceResult;

/**
 * Sends an instance-to-instance message to another instance and waits for its envelope.
 */
public interface LeaderTransport extends AutoCloseable {

    /**
     * @param targetInstanceId {@code host:port} of the receiving instance
     * @return the decoded envelope, or a failure envelope carrying the HTTP status for non-2xx replies
     * @throws com.iksanov.surveyshield.common.exception.TransferException on connect, I/O or timeout errors
     */
    <T> ServiceResult<T> send(String targetInstanceId, InstanceCommunicationPayload payload, TypeReference<ServiceResult<T>> responseType);

    @Override
    void close();
}
