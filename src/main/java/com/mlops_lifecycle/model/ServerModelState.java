package com.mlops_lifecycle.model;

import com.mlops_lifecycle.enumeration.ModelSourceEnum;
import com.mlops_lifecycle.enumeration.ServerStatusEnum;
import com.mlops_lifecycle.exception.ModelNotLoadedException;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * What the server acquired at startup. Built exactly once and never mutated afterwards;
 * every request handler reads the same instance.
 */
@Getter
@ToString(exclude = "model")
public final class ServerModelState {

    private final ServerStatusEnum status;
    private final LoadedModel model;
    private final ModelSourceEnum source;
    private final String versionLabel;
    private final String modelName;
    private final Instant loadedAt;

    private ServerModelState(ServerStatusEnum status, LoadedModel model, ModelSourceEnum source,
                             String versionLabel, String modelName, Instant loadedAt) {
        this.status = status;
        this.model = model;
        this.source = source;
        this.versionLabel = versionLabel;
        this.modelName = modelName;
        this.loadedAt = loadedAt;
    }

    public static ServerModelState uninitialized() {
        return new ServerModelState(ServerStatusEnum.UNINITIALIZED, null, ModelSourceEnum.NONE, null, null, null);
    }

    public static ServerModelState unavailable() {
        return new ServerModelState(ServerStatusEnum.UNAVAILABLE, null, ModelSourceEnum.NONE, null, null, null);
    }

    public static ServerModelState ready(LoadedModel model, ModelSourceEnum source, String versionLabel, String modelName) {
        if (model == null) {
            throw new IllegalArgumentException("A ready state needs a model");
        }
        return new ServerModelState(ServerStatusEnum.READY, model, source, versionLabel, modelName, Instant.now());
    }

    public boolean isReady() {
        return status == ServerStatusEnum.READY;
    }

    public LoadedModel requireModel() {
        if (!isReady()) {
            throw new ModelNotLoadedException();
        }
        return model;
    }
}
