package com.flagship.media_ledger.stitch.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.media_ledger.stitch.StitchJob;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * What the runner needs to execute one stitch.
 */
@Value
public class StitchJobSpec {

    @JsonProperty("job_id")
    UUID jobId;

    @JsonProperty("target_id")
    String targetId;

    @JsonProperty("input_paths")
    List<String> inputPaths;

    @JsonProperty("output_path")
    String outputPath;

    public static StitchJobSpec from(StitchJob job) {
        return new StitchJobSpec(job.getId(), job.getTargetId(), job.getInputPaths(), job.getOutputPath());
    }
}
