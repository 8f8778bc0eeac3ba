package com.autoposter.engine.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record BatchRequest(@Min(1) @Max(500) int count) {
}
