package com.eyelevel.paperprocessor.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * A batch of paper IDs to process concurrently. Each ID gets its own result, in the order given.
 */
@Getter
@Setter
public class BatchProcessRequest {

    @NotEmpty(message = "The 'ids' list cannot be empty.")
    @Size(max = 100, message = "A batch cannot contain more than 100 IDs.")
    private List<@NotBlank(message = "Paper IDs cannot be blank.") String> ids;

    private boolean includeRenderedArtifact;
}
