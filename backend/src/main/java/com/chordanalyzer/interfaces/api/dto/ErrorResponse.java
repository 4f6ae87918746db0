package com.chordanalyzer.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
