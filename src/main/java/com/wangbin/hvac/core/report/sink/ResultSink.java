package com.wangbin.hvac.core.report.sink;

import com.wangbin.hvac.core.report.model.PublishResult;
import com.wangbin.hvac.core.report.model.SinkRecord;

import java.util.List;
import java.util.Map;

/**
 * 控制结果写入端接口
 *
 * 职责：
 * 1. 将过滤后的执行器命令写入下游
 * 2. 不做重试，下一周期即重试
 * 3. 提供写入统计
 */
public interface ResultSink {

    /**
     * 获取写入端名称
     */
    String getName();

    /**
     * 初始化写入端
     *
     * @throws Exception 初始化失败时抛出异常
     */
    void init() throws Exception;

    /**
     * 批量写入记录，失败以结果返回而不抛出
     *
     * @param records 记录列表
     * @return 写入结果
     */
    PublishResult write(List<SinkRecord> records);

    /**
     * 写入端是否可用
     */
    boolean isHealthy();

    /**
     * 获取写入统计信息
     */
    Map<String, Object> getStatistics();

    /**
     * 销毁写入端
     */
    void destroy();
}
