package com.architectai.generation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class GenerateResponse {

    @JsonProperty("job_id")
    private String jobId;

    @JsonProperty("status")
    private String status;
}
