package com.mlops_lifecycle.strategy;

import com.mlops_lifecycle.enumeration.ModelSourceEnum;

/**
 * One way of obtaining the production model at server startup.
 * Implementations report failure through the result instead of throwing, so the
 * initializer can simply walk them in priority order.
 */
public interface ModelAcquisitionStrategy {

    ModelSourceEnum source();

    AcquisitionResult acquire();
}
