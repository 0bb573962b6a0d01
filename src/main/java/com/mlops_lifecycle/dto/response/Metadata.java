package com.mlops_lifecycle.dto.response;

import lombok.*;

import java.util.UUID;
import java.time.Instant;

@AllArgsConstructor
@Getter
@Setter
public class Metadata {

    private Instant timestamp;

    private String transactionId;

    public Metadata() {
        this.timestamp = Instant.now();
        this.transactionId = UUID.randomUUID().toString();
    }
}
