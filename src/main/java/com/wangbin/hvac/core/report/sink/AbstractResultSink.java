package com.wangbin.hvac.core.report.sink;

import com.wangbin.hvac.common.exception.EngineException;
import com.wangbin.hvac.core.report.model.PublishResult;
import com.wangbin.hvac.core.report.model.SinkRecord;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 抽象写入端
 *
 * 职责：
 * 1. 统一的空记录处理与异常捕获
 * 2. 记录写入统计信息
 */
@Slf4j
@Getter
public abstract class AbstractResultSink implements ResultSink {

    // 写入端名称
    protected final String name;

    // 写入端描述
    protected final String description;

    protected final AtomicLong totalWriteCount = new AtomicLong(0);
    protected final AtomicLong successWriteCount = new AtomicLong(0);
    protected final AtomicLong failureWriteCount = new AtomicLong(0);
    protected final AtomicLong totalRecordCount = new AtomicLong(0);
    protected final AtomicLong totalCostTime = new AtomicLong(0);

    protected volatile long lastSuccessTime;
    protected volatile String lastError;

    protected AbstractResultSink(String name, String description) {
        this.name = name;
        this.description = description;
    }

    @Override
    public void init() throws Exception {
        log.info("初始化结果写入端：{}", name);
        try {
            doInit();
            log.info("结果写入端初始化完成：{}", name);
        } catch (Exception e) {
            log.error("结果写入端初始化失败：{}", name, e);
            throw e;
        }
    }

    @Override
    public PublishResult write(List<SinkRecord> records) {
        if (records == null || records.isEmpty()) {
            return PublishResult.skipped(name);
        }

        long startTime = System.currentTimeMillis();
        PublishResult result;
        try {
            result = doWrite(records);
        } catch (EngineException e) {
            log.error("结果写入失败：{}，记录数：{}，错误：{}", name, records.size(), e.getMessage(), e);
            result = PublishResult.error(name, e.getMessage());
        } catch (Exception e) {
            EngineException wrapped = EngineException.publishException("写入 " + name + " 失败", e);
            log.error("结果写入异常：{}，记录数：{}", name, records.size(), wrapped);
            result = PublishResult.error(name, wrapped.getMessage() + ": " + e.getMessage());
        }

        long costTime = System.currentTimeMillis() - startTime;
        result.setCostTime(costTime);
        recordWrite(result, records.size(), costTime);
        return result;
    }

    protected void recordWrite(PublishResult result, int recordCount, long costTime) {
        totalWriteCount.incrementAndGet();
        totalCostTime.addAndGet(costTime);
        if (result.isSuccess()) {
            successWriteCount.incrementAndGet();
            totalRecordCount.addAndGet(recordCount);
            lastSuccessTime = System.currentTimeMillis();
        } else {
            failureWriteCount.incrementAndGet();
            lastError = result.getErrorMessage();
        }
    }

    @Override
    public boolean isHealthy() {
        long total = totalWriteCount.get();
        if (total == 0) {
            return true;
        }
        // 最近一次失败晚于最近一次成功视为不健康
        return lastError == null || lastSuccessTime > 0 && failureWriteCount.get() * 2 < total;
    }

    @Override
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new HashMap<>();
        long total = totalWriteCount.get();
        stats.put("name", name);
        stats.put("description", description);
        stats.put("totalWriteCount", total);
        stats.put("successWriteCount", successWriteCount.get());
        stats.put("failureWriteCount", failureWriteCount.get());
        stats.put("totalRecordCount", totalRecordCount.get());
        stats.put("avgCostTime", total > 0 ? totalCostTime.get() / total : 0);
        stats.put("successRate", total > 0 ? (double) successWriteCount.get() / total * 100 : 100.0);
        stats.put("lastSuccessTime", lastSuccessTime);
        stats.put("lastError", lastError);
        return stats;
    }

    @Override
    public void destroy() {
        log.info("销毁结果写入端：{}", name);
        try {
            doDestroy();
        } catch (Exception e) {
            log.error("结果写入端销毁失败：{}", name, e);
        }
    }

    protected void doInit() throws Exception {
    }

    protected abstract PublishResult doWrite(List<SinkRecord> records) throws Exception;

    protected void doDestroy() throws Exception {
    }
}
