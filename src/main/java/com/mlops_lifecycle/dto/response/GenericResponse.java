package com.mlops_lifecycle.dto.response;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error envelope for every non-2xx answer of the serving API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenericResponse<T> {
    private T dataHeader;
    private String errorCode;
    private String message;
    private Metadata metadata;

    public static <T> GenericResponse<T> failure(String errorCode, String message) {
        return GenericResponse.<T>builder()
                .errorCode(errorCode)
                .message(message)
                .metadata(new Metadata())
                .build();
    }

}
