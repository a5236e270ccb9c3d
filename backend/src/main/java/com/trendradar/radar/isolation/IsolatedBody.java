package com.trendradar.radar.isolation;

import com.trendradar.radar.model.ConfigSnapshot;

@FunctionalInterface
public interface IsolatedBody<T> {
    T run(ConfigSnapshot activeConfig) throws Exception;
}
