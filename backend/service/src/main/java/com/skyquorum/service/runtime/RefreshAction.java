package com.skyquorum.service.runtime;

import com.skyquorum.service.coordinator.RefreshResult;

import java.util.List;

@FunctionalInterface
public interface RefreshAction {
    RefreshResult refresh(List<String> cities, String trigger);
}
