package com.wangbin.hvac.core.report.sink;

import com.wangbin.hvac.common.utils.JsonUtil;
import com.wangbin.hvac.core.report.model.PublishResult;
import com.wangbin.hvac.core.report.model.SinkRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 仅记录日志的写入端，用于试运行
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hvac.sink", name = "mode", havingValue = "log", matchIfMissing = true)
public class LoggingResultSink extends AbstractResultSink {

    public LoggingResultSink() {
        super("log", "日志试运行写入端");
    }

    @Override
    protected PublishResult doWrite(List<SinkRecord> records) {
        for (SinkRecord record : records) {
            log.info("[试运行] {} {}/{} -> {}", record.getMeasurement(), record.getLocationId(),
                    record.getEquipmentId(), JsonUtil.toJsonString(record.getFields()));
        }
        return PublishResult.success(name, records.size());
    }
}
