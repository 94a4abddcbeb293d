package com.eyelevel.archiveunzipper.controller;

import com.eyelevel.archiveunzipper.dto.unzip.request.UnzipRequest;
import com.eyelevel.archiveunzipper.exception.handler.GlobalExceptionHandler;
import com.eyelevel.archiveunzipper.model.TaskStatus;
import com.eyelevel.archiveunzipper.service.pipeline.UnzipPipelineService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class UnzipControllerTest {

    private static final String VALID_BODY = """
            {
              "sourceBlobUrl": "https://s3.example.com",
              "destinationBlobUrl": "https://s3.example.com",
              "sourceContainerName": "inbound",
              "destinationContainerName": "outbound",
              "sourceBlobName": "batch.zip",
              "destinationFolderName": "drop",
              "topicName": "unzipped-file-events",
              "correlationId": "CORR-1",
              "intId": "INT-1",
              "eventType": "FileUnzipped",
              "zipFileName": "batch.zip"
            }
            """;

    @Mock
    private UnzipPipelineService unzipPipelineService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new UnzipController(unzipPipelineService))
                                 .setControllerAdvice(new GlobalExceptionHandler())
                                 .build();
    }

    @Test
    void runUnzip_ReturnsStatusRecord() throws Exception {
        when(unzipPipelineService.run(any(UnzipRequest.class))).thenReturn(new TaskStatus(TaskStatus.SUCCEEDED));

        mockMvc.perform(post("/unzip/v1/runs").contentType(MediaType.APPLICATION_JSON).content(VALID_BODY))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.CurrentTaskStatus").value(TaskStatus.SUCCEEDED));
    }

    @Test
    void runUnzip_FailedRunStillAnswersOk() throws Exception {
        when(unzipPipelineService.run(any(UnzipRequest.class)))
                .thenReturn(new TaskStatus("Error: Source object 'batch.zip' not found."));

        mockMvc.perform(post("/unzip/v1/runs").contentType(MediaType.APPLICATION_JSON).content(VALID_BODY))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.CurrentTaskStatus").value("Error: Source object 'batch.zip' not found."));
    }

    @Test
    void runUnzip_AcceptsPascalCaseFields() throws Exception {
        when(unzipPipelineService.run(any(UnzipRequest.class))).thenReturn(new TaskStatus(TaskStatus.SUCCEEDED));
        String body = """
                {
                  "SourceBlobUrl": "https://s3.example.com",
                  "DestinationBlobUrl": "https://s3.example.com",
                  "SourceContainerName": "inbound",
                  "DestinationContainerName": "outbound",
                  "SourceBlobName": "batch.zip",
                  "DestinationFolderName": "",
                  "TopicName": "unzipped-file-events",
                  "CorrelationId": "CORR-1",
                  "IntId": "INT-1",
                  "EventType": "FileUnzipped",
                  "ZipFileName": "batch.zip"
                }
                """;

        mockMvc.perform(post("/unzip/v1/runs").contentType(MediaType.APPLICATION_JSON).content(body))
               .andExpect(status().isOk());

        ArgumentCaptor<UnzipRequest> captor = ArgumentCaptor.forClass(UnzipRequest.class);
        verify(unzipPipelineService).run(captor.capture());
        assertEquals("inbound", captor.getValue().sourceContainerName());
        assertEquals("", captor.getValue().destinationFolderName());
        assertEquals("CORR-1", captor.getValue().correlationId());
    }

    @Test
    void runUnzip_BlankField_IsRejected() throws Exception {
        String body = VALID_BODY.replace("\"topicName\": \"unzipped-file-events\"", "\"topicName\": \" \"");

        mockMvc.perform(post("/unzip/v1/runs").contentType(MediaType.APPLICATION_JSON).content(body))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.displayMessage").value("Invalid input provided."))
               .andExpect(jsonPath("$.errorDetail")
                                  .value("Validation failed: 'topicName': The 'topicName' cannot be empty."));

        verifyNoInteractions(unzipPipelineService);
    }

    @Test
    void runUnzip_MalformedBody_IsRejected() throws Exception {
        mockMvc.perform(post("/unzip/v1/runs").contentType(MediaType.APPLICATION_JSON).content("{not json"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.displayMessage").value("Malformed request body."));

        verifyNoInteractions(unzipPipelineService);
    }

    @Test
    void runUnzip_WrongMethod_IsRejected() throws Exception {
        mockMvc.perform(get("/unzip/v1/runs"))
               .andExpect(status().isMethodNotAllowed());
    }
}
