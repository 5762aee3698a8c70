package com.helix.guardrails.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GitProperties {

    /**
     * Root directory that workspace-relative repository paths resolve against.
     */
    @NotBlank
    private String workspace = "~/projects";

    @Min(1)
    private int timeoutSeconds = 30;
}
