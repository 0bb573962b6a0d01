package com.mlops_lifecycle.enumeration;

public enum PromotionOutcomeEnum {
    PROMOTED,
    REJECTED
}
