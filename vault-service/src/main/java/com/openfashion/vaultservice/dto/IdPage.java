package com.openfashion.vaultservice.dto;

import java.util.List;

public record IdPage(
        long total,
        List<Long> ids
) {}
