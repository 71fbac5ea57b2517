package com.eyelevel.paperprocessor.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.eyelevel.paperprocessor.model.ErrorType;
import com.eyelevel.paperprocessor.model.PipelineStatus;
import com.eyelevel.paperprocessor.model.ProcessingRequest;
import com.eyelevel.paperprocessor.model.ProcessingResult;
import com.eyelevel.paperprocessor.service.pipeline.PaperPipelineService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Web-layer tests for the paper processing endpoints and their error mapping.
 */
@WebMvcTest(controllers = PaperProcessingController.class)
class PaperProcessingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PaperPipelineService pipelineService;

    @Test
    void process_returnsResultOnSuccess() throws Exception {
        when(pipelineService.process(new ProcessingRequest("2404.04895", false)))
                .thenReturn(ProcessingResult.success("2404.04895", "main.tex", "Hello [MATH]", 3));

        mockMvc.perform(post("/papers/v1/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"2404.04895\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.displayMessage").value("Paper processed successfully."))
                .andExpect(jsonPath("$.response.success").value(true))
                .andExpect(jsonPath("$.response.mainFile").value("main.tex"))
                .andExpect(jsonPath("$.response.fileCount").value(3))
                .andExpect(jsonPath("$.response.error").doesNotExist());
    }

    @Test
    void process_mapsInvalidIdToBadRequest() throws Exception {
        when(pipelineService.process(any(ProcessingRequest.class)))
                .thenReturn(ProcessingResult.failure("nope", ErrorType.VALIDATION, "Invalid arXiv identifier: 'nope'"));

        mockMvc.perform(post("/papers/v1/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"nope\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.response.errorType").value("VALIDATION"))
                .andExpect(jsonPath("$.statusCode").value(400));
    }

    @Test
    void process_keepsOkForStageFailures() throws Exception {
        when(pipelineService.process(any(ProcessingRequest.class)))
                .thenReturn(ProcessingResult.failure("2404.04895", ErrorType.DOWNLOAD, "HTTP 404"));

        mockMvc.perform(post("/papers/v1/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"2404.04895\",\"includeRenderedArtifact\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.displayMessage").value("Paper processing failed."))
                .andExpect(jsonPath("$.response.errorType").value("DOWNLOAD"));
        verify(pipelineService).process(new ProcessingRequest("2404.04895", true));
    }

    @Test
    void process_rejectsBlankIdBeforeProcessing() throws Exception {
        mockMvc.perform(post("/papers/v1/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.displayMessage").value("Invalid input provided."))
                .andExpect(jsonPath("$.statusCode").value(400));
        verifyNoInteractions(pipelineService);
    }

    @Test
    void process_rejectsMalformedBody() throws Exception {
        mockMvc.perform(post("/papers/v1/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.displayMessage").value("Malformed request body."));
    }

    @Test
    void processBatch_reportsFailureCount() throws Exception {
        when(pipelineService.processMany(eq(List.of("2404.00001", "2404.00002")), eq(false))).thenReturn(List.of(
                ProcessingResult.success("2404.00001", "main.tex", "text", 1),
                ProcessingResult.failure("2404.00002", ErrorType.EXTRACTION, "Invalid or corrupted archive")));

        mockMvc.perform(post("/papers/v1/process/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ids\":[\"2404.00001\",\"2404.00002\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.displayMessage").value("Processed 2 paper(s); 1 failed."))
                .andExpect(jsonPath("$.response[0].id").value("2404.00001"))
                .andExpect(jsonPath("$.response[1].errorType").value("EXTRACTION"));
    }

    @Test
    void processBatch_rejectsEmptyList() throws Exception {
        mockMvc.perform(post("/papers/v1/process/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ids\":[]}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(pipelineService);
    }

    @Test
    void processBatch_mapsRejectedWorkToServiceUnavailable() throws Exception {
        when(pipelineService.processMany(any(), eq(true)))
                .thenThrow(new TaskRejectedException("pool exhausted"));

        mockMvc.perform(post("/papers/v1/process/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ids\":[\"2404.00001\"],\"includeRenderedArtifact\":true}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.statusCode").value(503));
    }

    @Test
    void status_returnsLimitsAndSlots() throws Exception {
        when(pipelineService.status()).thenReturn(new PipelineStatus(
                new PipelineStatus.Limits(5, 3, 2, 2.0, 1000),
                new PipelineStatus.Slots(4, 3, 2),
                Map.of("processed.success", 7.0)));

        mockMvc.perform(get("/papers/v1/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response.limits.maxDownloads").value(5))
                .andExpect(jsonPath("$.response.availableSlots.download").value(4))
                .andExpect(jsonPath("$.response.counters['processed.success']").value(7.0));
    }

    @Test
    void status_rejectsWrongMethod() throws Exception {
        mockMvc.perform(post("/papers/v1/status"))
                .andExpect(status().isMethodNotAllowed());
    }
}
