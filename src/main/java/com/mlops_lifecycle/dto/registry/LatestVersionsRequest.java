package com.mlops_lifecycle.dto.registry;

import java.util.List;

public record LatestVersionsRequest(
        String name,
        List<String> stages
) {}
