package com.wangbin.hvac.core.source;

import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.UserCommand;

import java.time.Duration;
import java.util.List;

/**
 * 用户命令源：返回回看窗口内的命令，按时间倒序
 */
public interface CommandSource {

    String getName();

    List<UserCommand> recentCommands(String locationId, EquipmentType type, Duration lookback, int limit);
}
