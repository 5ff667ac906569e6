package com.pipeline.amts.model;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * 配置与缓存的比对结果
 */
public final class CacheDiff {
    /** 新增、定义变化或原始输入更新的切片 */
    private final Set<String> changed;
    /** 与缓存一致的切片 */
    private final Set<String> unchanged;
    /** 缓存中存在但已不在配置中的切片（孤立条目，只报告不删除） */
    private final Set<String> removed;

    public CacheDiff(Set<String> changed, Set<String> unchanged, Set<String> removed) {
        this.changed = ImmutableSet.copyOf(changed);
        this.unchanged = ImmutableSet.copyOf(unchanged);
        this.removed = ImmutableSet.copyOf(removed);
    }

    public Set<String> getChanged() { return changed; }
    public Set<String> getUnchanged() { return unchanged; }
    public Set<String> getRemoved() { return removed; }

    public boolean hasChanges() {
        return !changed.isEmpty();
    }

    @Override
    public String toString() {
        return "CacheDiff{changed=" + changed.size() + ", unchanged=" + unchanged.size()
                + ", removed=" + removed.size() + "}";
    }
}
