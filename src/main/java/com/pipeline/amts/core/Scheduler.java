package com.pipeline.amts.core;

import com.pipeline.amts.model.Command;
import com.pipeline.amts.model.ConfigLoadResult;
import com.pipeline.amts.model.SchedulerState;

import java.time.Duration;

/**
 * 调度器接口：变更检测与切片调度的状态机。
 *
 * 状态转换：
 *   IDLE → EVALUATING → DISPATCHING → DRAINING → IDLE（或 TERMINATED）
 *
 * 外部只能通过 submit 投递命令，命令在调度器自己的线程中执行；
 * 其它组件不直接修改调度器状态。
 */
public interface Scheduler {

    /**
     * 启动调度线程，并立即执行一次评估。
     */
    void start();

    /**
     * 投递控制命令，立即返回。
     *
     * @param command 控制命令
     * @return 是否被接受（已终止时返回false）
     */
    boolean submit(Command command);

    /**
     * @return 当前状态
     */
    SchedulerState getState();

    /**
     * 最近一次成功加载的配置（含被拒绝的行）。
     *
     * @return 配置加载结果；尚未加载时为空结果
     */
    ConfigLoadResult lastLoad();

    /**
     * 等待调度器终止。
     *
     * @param timeout 最长等待时间
     * @return 是否已终止
     * @throws InterruptedException 等待被中断
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;

    /**
     * 等价于 submit(STOP) 并等待终止，释放线程池。
     */
    void shutdown();
}
