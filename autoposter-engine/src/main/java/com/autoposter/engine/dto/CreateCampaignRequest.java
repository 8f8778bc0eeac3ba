package com.autoposter.engine.dto;

import com.autoposter.engine.model.SelectionStrategy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
public class CreateCampaignRequest {

    @NotBlank
    private String name;

    @NotEmpty
    private List<@NotBlank String> videoPaths = new ArrayList<>();

    @Size(max = 2200)
    private String captionTemplate;

    @NotNull
    private SelectionStrategy strategy = SelectionStrategy.ALL;

    private Integer sampleSize;
    private List<Long> accountIds = new ArrayList<>();
    private Long proxyId;
    private Integer maxAccounts;

    @NotNull
    private Instant startTime;

    @NotNull
    private Instant endTime;

    @Min(0)
    private long delayMinSeconds;

    @Min(0)
    private long delayMaxSeconds;

    @Min(0)
    private Integer maxRetries;

    private Long randomSeed;
}
