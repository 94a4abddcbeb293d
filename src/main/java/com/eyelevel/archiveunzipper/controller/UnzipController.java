package com.eyelevel.archiveunzipper.controller;

import com.eyelevel.archiveunzipper.dto.unzip.request.UnzipRequest;
import com.eyelevel.archiveunzipper.model.TaskStatus;
import com.eyelevel.archiveunzipper.service.pipeline.UnzipPipelineService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP trigger for the unzip pipeline.
 */
@Slf4j
@RestController
@RequestMapping("/unzip")
@RequiredArgsConstructor
public class UnzipController implements UnzipApi {

    private final UnzipPipelineService unzipPipelineService;

    @Override
    @PostMapping("/v1/runs")
    public ResponseEntity<TaskStatus> runUnzip(@Valid @RequestBody final UnzipRequest request) {
        log.info("Unzip requested for '{}' in container '{}' (correlation id {}).", request.sourceBlobName(),
                 request.sourceContainerName(), request.correlationId());
        return ResponseEntity.ok(unzipPipelineService.run(request));
    }
}
