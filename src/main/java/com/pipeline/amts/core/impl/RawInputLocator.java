package com.pipeline.amts.core.impl;

import com.pipeline.amts.core.InputTracker;
import com.pipeline.amts.model.SliceDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 原始输入文件定位。
 * 在切片的 ImportFolder 下按文件画像的 glob 规则查找文件，结果按路径排序。
 * glob 相对于 ImportFolder 匹配，不含 "/" 的规则只匹配顶层文件。
 */
public class RawInputLocator implements InputTracker {

    private static final Logger log = LoggerFactory.getLogger(RawInputLocator.class);

    /**
     * 定位切片的原始文件。
     *
     * @return 匹配的文件，按路径升序；目录不存在时为空
     * @throws UncheckedIOException 目录存在但无法遍历
     */
    public List<Path> locate(SliceDefinition definition) {
        Path root = definition.getImportFolder();
        if (!Files.isDirectory(root)) {
            log.warn("Import folder {} for slice '{}' does not exist.", root, definition.getSliceId());
            return new ArrayList<>();
        }

        String pattern = definition.getMatchPattern().replace('\\', '/');
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        int depth = pattern.contains("**") ? Integer.MAX_VALUE : pattern.split("/").length;

        try (Stream<Path> walk = Files.walk(root, depth)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(root.relativize(p)))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list import folder " + root, e);
        }
    }

    @Override
    public long latestModified(SliceDefinition definition) {
        long latest = 0L;
        for (Path file : locate(definition)) {
            try {
                latest = Math.max(latest, Files.getLastModifiedTime(file).toMillis());
            } catch (IOException e) {
                log.warn("Cannot stat raw file {}: {}", file, e.getMessage());
            }
        }
        return latest;
    }
}
