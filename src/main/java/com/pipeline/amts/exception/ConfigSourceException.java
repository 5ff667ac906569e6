package com.pipeline.amts.exception;

/**
 * 配置源整体不可读（文件缺失、无法解析或缺少必需列）。
 * 启动时视为致命错误；运行期间仅记录日志，调度器保持空闲。
 */
public class ConfigSourceException extends RuntimeException {

    public ConfigSourceException(String message) {
        super(message);
    }

    public ConfigSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
