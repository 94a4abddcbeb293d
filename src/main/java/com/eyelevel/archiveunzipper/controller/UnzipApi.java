package com.eyelevel.archiveunzipper.controller;

import com.eyelevel.archiveunzipper.dto.common.ApiResponse;
import com.eyelevel.archiveunzipper.dto.unzip.request.UnzipRequest;
import com.eyelevel.archiveunzipper.model.TaskStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;

@Tag(name = "Archive Unzip", description = "Extracts a stored ZIP archive and announces every extracted file.")
public interface UnzipApi {

    @Operation(summary = "Run Unzip",
            description = "Downloads the archive, uploads each file entry to the destination folder and sends one "
                    + "notification per entry. The run is synchronous and always answers with a status record; "
                    + "failures are reported in the status text.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "The run finished. Check the status text for the outcome.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = TaskStatus.class),
                            examples = {
                                    @ExampleObject(name = "Success", value = """
                                            {
                                                "CurrentTaskStatus": "Files unzipped and uploaded to destination successfully."
                                            }
                                            """),
                                    @ExampleObject(name = "Failure", value = """
                                            {
                                                "CurrentTaskStatus": "Error: Source container 'inbound-archives' not found."
                                            }
                                            """)
                            })),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Missing or invalid request fields.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<TaskStatus> runUnzip(@RequestBody UnzipRequest request);
}
