package com.vibedeutsch.backend.lexicon.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record SenseCorrectionRequest(
        @Size(max = 32) String pos,
        @Pattern(regexp = "masc|fem|neut") String gender
) {}
