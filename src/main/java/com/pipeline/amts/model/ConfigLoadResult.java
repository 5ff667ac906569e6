package com.pipeline.amts.model;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * 一次配置加载的结果：有效的活跃切片定义 + 被拒绝的行
 */
public final class ConfigLoadResult {
    private final List<SliceDefinition> definitions;
    private final List<RowError> rowErrors;

    public ConfigLoadResult(List<SliceDefinition> definitions, List<RowError> rowErrors) {
        this.definitions = ImmutableList.copyOf(definitions);
        this.rowErrors = ImmutableList.copyOf(rowErrors);
    }

    public static ConfigLoadResult empty() {
        return new ConfigLoadResult(List.of(), List.of());
    }

    public List<SliceDefinition> getDefinitions() { return definitions; }
    public List<RowError> getRowErrors() { return rowErrors; }

    public Optional<SliceDefinition> find(String sliceId) {
        return definitions.stream().filter(d -> d.getSliceId().equals(sliceId)).findFirst();
    }
}
