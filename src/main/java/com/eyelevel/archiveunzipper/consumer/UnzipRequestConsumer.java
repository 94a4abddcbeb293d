package com.eyelevel.archiveunzipper.consumer;

import com.eyelevel.archiveunzipper.dto.unzip.request.UnzipRequest;
import com.eyelevel.archiveunzipper.model.TaskStatus;
import com.eyelevel.archiveunzipper.service.pipeline.UnzipPipelineService;
import io.awspring.cloud.sqs.annotation.SqsListener;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs the unzip pipeline for requests arriving on the request queue.
 * <p>
 * A run never throws, so every message is acknowledged once its status is known. Invalid requests
 * are logged and dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.unzip.request-listener", name = "enabled", havingValue = "true")
public class UnzipRequestConsumer {

    private final UnzipPipelineService unzipPipelineService;
    private final Validator validator;

    @SqsListener(value = "${aws.sqs.unzip-request-queue-name}", factory = "unzipRequestContainerFactory")
    public void onUnzipRequest(@Payload final UnzipRequest request) {
        final Set<ConstraintViolation<UnzipRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String errors = violations.stream().map(ConstraintViolation::getMessage).sorted()
                                      .collect(Collectors.joining(" "));
            log.error("[FATAL] Unzip request is invalid and will be dropped: {}", errors);
            return;
        }

        log.info("Received unzip request for '{}' (correlation id {}).", request.sourceBlobName(),
                 request.correlationId());
        final TaskStatus status = unzipPipelineService.run(request);
        log.info("[{}] Final status: {}", request.correlationId(), status.getCurrentTaskStatus());
    }
}
