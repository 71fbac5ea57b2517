package com.eyelevel.paperprocessor.controller;

import com.eyelevel.paperprocessor.dto.common.ApiResponse;
import com.eyelevel.paperprocessor.dto.request.BatchProcessRequest;
import com.eyelevel.paperprocessor.dto.request.ProcessPaperRequest;
import com.eyelevel.paperprocessor.model.ErrorType;
import com.eyelevel.paperprocessor.model.PipelineStatus;
import com.eyelevel.paperprocessor.model.ProcessingRequest;
import com.eyelevel.paperprocessor.model.ProcessingResult;
import com.eyelevel.paperprocessor.service.pipeline.PaperPipelineService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for running papers through the processing pipeline.
 * All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/papers")
@RequiredArgsConstructor
@Validated
public class PaperProcessingController {

    private final PaperPipelineService pipelineService;

    @PostMapping("/v1/process")
    public ResponseEntity<ApiResponse<ProcessingResult>> process(@Valid @RequestBody final ProcessPaperRequest request) {

        log.info("Processing request for paper: {}, includeRenderedArtifact: {}", request.getId(),
                request.isIncludeRenderedArtifact());

        ProcessingResult result = pipelineService.process(
                new ProcessingRequest(request.getId(), request.isIncludeRenderedArtifact()));

        HttpStatus status = !result.isSuccess() && result.getErrorType() == ErrorType.VALIDATION
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.OK;

        ApiResponse<ProcessingResult> response = ApiResponse.<ProcessingResult>builder()
                .response(result)
                .displayMessage(result.isSuccess() ? "Paper processed successfully." : "Paper processing failed.")
                .showMessage(!result.isSuccess())
                .statusCode(status.value())
                .build();

        return ResponseEntity.status(status).body(response);
    }

    @PostMapping("/v1/process/batch")
    public ResponseEntity<ApiResponse<List<ProcessingResult>>> processBatch(
            @Valid @RequestBody final BatchProcessRequest request) {

        log.info("Batch processing request for {} paper(s), includeRenderedArtifact: {}", request.getIds().size(),
                request.isIncludeRenderedArtifact());

        List<ProcessingResult> results = pipelineService.processMany(request.getIds(),
                request.isIncludeRenderedArtifact());
        long failed = results.stream().filter(result -> !result.isSuccess()).count();

        ApiResponse<List<ProcessingResult>> response = ApiResponse.<List<ProcessingResult>>builder()
                .response(results)
                .displayMessage(String.format("Processed %d paper(s); %d failed.", results.size(), failed))
                .showMessage(failed > 0)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }

    @GetMapping("/v1/status")
    public ResponseEntity<ApiResponse<PipelineStatus>> status() {
        ApiResponse<PipelineStatus> response = ApiResponse.<PipelineStatus>builder()
                .response(pipelineService.status())
                .displayMessage("Pipeline status retrieved successfully.")
                .showMessage(false)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }
}
