package com.helix.guardrails.workflow.state;

import lombok.Builder;
import lombok.Value;

/**
 * Already-fetched pull request data to check against the project's design.
 */
@Value
@Builder
public class ScopeCheckRequest {
    String projectId;
    /** Repository URL or owner/name; also the key of the stored repo map. */
    String repoName;
    int prNumber;
    String prTitle;
    String prDescription;
    String diff;
    /** Design text to check against; when null it is retrieved for the project. */
    String designDoc;
}
