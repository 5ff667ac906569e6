package com.pipeline.amts.model;

/**
 * 调度器状态
 */
public enum SchedulerState {
    /** 等待配置变更信号、命令或轮询超时 */
    IDLE,
    /** 加载配置并与缓存比对 */
    EVALUATING,
    /** 生成工作项 */
    DISPATCHING,
    /** 执行工作项并提交缓存 */
    DRAINING,
    /** 已退出 */
    TERMINATED
}
