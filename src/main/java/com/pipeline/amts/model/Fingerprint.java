package com.pipeline.amts.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 切片定义的内容摘要，用于判断定义是否发生变化。
 * 字段按名称排序后参与计算，与字段声明顺序无关。
 */
public final class Fingerprint implements Serializable {

    private final String value;

    private Fingerprint(String value) {
        this.value = value;
    }

    @JsonCreator
    public static Fingerprint of(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("Fingerprint value must not be blank");
        }
        return new Fingerprint(hex);
    }

    /**
     * 计算切片定义的摘要（SHA-256）
     */
    public static Fingerprint compute(SliceDefinition definition) {
        Hasher hasher = Hashing.sha256().newHasher();
        for (Map.Entry<String, String> field : canonicalFields(definition).entrySet()) {
            hasher.putString(field.getKey(), StandardCharsets.UTF_8)
                    .putChar('=')
                    .putString(field.getValue(), StandardCharsets.UTF_8)
                    .putChar('\u001f');
        }
        return new Fingerprint(hasher.hash().toString());
    }

    /** 切片定义的规范化字段表，包含引用的文件画像 */
    static SortedMap<String, String> canonicalFields(SliceDefinition d) {
        SortedMap<String, String> fields = new TreeMap<>();
        fields.put("sliceId", d.getSliceId());
        fields.put("sensorId", d.getSensorId());
        fields.put("site", d.getSite());
        fields.put("pointName", d.getPointName());
        fields.put("type", d.getType().name());
        fields.put("importFolder", str(d.getImportFolder()));
        fields.put("exportFolder", str(d.getExportFolder()));
        fields.put("baselineNorth", str(d.getBaselineNorth()));
        fields.put("baselineEast", str(d.getBaselineEast()));
        fields.put("baselineHeight", Double.toString(d.getBaselineHeight()));
        fields.put("outlierThreshold", Double.toString(d.getOutlierThreshold()));
        fields.put("startTimestamp", d.getStartTimestamp().toString());
        fields.put("timeZone", str(d.getTimeZone()));
        fields.put("active", Boolean.toString(d.isActive()));
        fields.put("sqlExport", Boolean.toString(d.isSqlExport()));

        FileProfile p = d.getProfile();
        fields.put("profile.name", p.getName());
        fields.put("profile.match", p.getMatchPattern());
        fields.put("profile.timeZone", str(p.getTimeZone()));
        fields.put("profile.timeFormat", str(p.getTimeFormat()));
        fields.put("profile.columnTime", p.getTimeColumn());
        fields.put("profile.columnPoint", p.getPointColumn());
        fields.put("profile.columnNorthing", p.getNorthingColumn());
        fields.put("profile.columnEasting", p.getEastingColumn());
        fields.put("profile.columnElevation", p.getElevationColumn());
        return fields;
    }

    private static String str(Object o) {
        return o == null ? "" : o.toString();
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fingerprint)) return false;
        return value.equals(((Fingerprint) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value.length() > 12 ? value.substring(0, 12) : value;
    }
}
