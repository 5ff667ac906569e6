package com.pipeline.amts.core;

import com.pipeline.amts.model.ConfigLoadResult;

import java.nio.file.Path;
import java.util.List;

/**
 * 配置存储接口：活跃切片定义的唯一来源。
 *
 * 每次调用都完整读取配置源，不做增量比对（比对由SliceCache负责）。
 * 结果只取决于配置源当前内容。
 *
 * 行级校验约定：
 * - 缺少必需字段、类型/时区/画像无法解析的行记为RowError并排除，不影响其它行
 * - 切片标识重复时，后出现的行被拒绝
 * - Active=false 的行不出现在返回结果中
 */
public interface ConfigStore {

    /**
     * 读取配置源并返回有效的活跃切片定义及被拒绝的行。
     * 返回顺序无意义，下游一律以sliceId识别切片。
     *
     * @return 加载结果
     * @throws com.pipeline.amts.exception.ConfigSourceException 配置源整体不可读时抛出
     */
    ConfigLoadResult load();

    /**
     * 配置源涉及的文件，供文件监听使用。
     *
     * @return 需要监听变更的文件列表
     */
    List<Path> sourceFiles();
}
