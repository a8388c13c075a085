package com.openfashion.vaultservice.dto;

public record SubmissionResult(Long id) {}
