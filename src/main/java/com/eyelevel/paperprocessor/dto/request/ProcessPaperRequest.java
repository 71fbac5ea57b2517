package com.eyelevel.paperprocessor.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ProcessPaperRequest {

    @NotBlank(message = "The 'id' field cannot be empty.")
    @Size(max = 64, message = "The 'id' field cannot exceed 64 characters.")
    private String id;

    private boolean includeRenderedArtifact;
}
