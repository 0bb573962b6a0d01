package com.mlops_lifecycle.enumeration;

import lombok.Getter;

/**
 * Process exit codes of the promotion job.
 */
@Getter
public enum PromotionExitCodeEnum {
    PROMOTED(0),
    THRESHOLD_NOT_MET(1),
    INVALID_INPUT(2),
    PROMOTION_FAILED(3);

    private final int code;

    PromotionExitCodeEnum(int code) {
        this.code = code;
    }
}
