package com.mergeql.core;

import com.mergeql.core.config.MergeSettings;
import com.mergeql.core.config.StoreConfig;

public interface Plugin {
    MergeEngine createEngine(StoreConfig config, MergeSettings settings);
    void cleanUp();
}
