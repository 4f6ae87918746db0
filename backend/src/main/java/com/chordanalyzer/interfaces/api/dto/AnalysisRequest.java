package com.chordanalyzer.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AnalysisRequest(
        @NotBlank(message = "코드 진행을 입력해주세요")
        @Size(max = 500, message = "코드 진행은 최대 500자까지 입력할 수 있습니다")
        String progression
) {}
