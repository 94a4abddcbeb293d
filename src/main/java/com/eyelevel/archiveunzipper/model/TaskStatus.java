package com.eyelevel.archiveunzipper.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * The status record returned to the caller of a run. It holds one human-readable line: the
 * starting text while the run is in progress, then either the success text or an error description.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TaskStatus {

    public static final String STARTING = "Starting the file unzip process.";
    public static final String SUCCEEDED = "Files unzipped and uploaded to destination successfully.";
    public static final String ERROR_PREFIX = "Error: ";

    @JsonProperty("CurrentTaskStatus")
    private String currentTaskStatus;

    public static TaskStatus starting() {
        return new TaskStatus(STARTING);
    }
}
