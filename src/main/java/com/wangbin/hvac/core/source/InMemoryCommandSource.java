package com.wangbin.hvac.core.source;

import com.wangbin.hvac.core.model.EquipmentType;
import com.wangbin.hvac.core.model.UserCommand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.stream.Collectors;

/**
 * 进程内命令源
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hvac.source", name = "mode", havingValue = "memory", matchIfMissing = true)
public class InMemoryCommandSource implements CommandSource {

    private static final int MAX_RETAINED = 5000;

    private final Deque<UserCommand> commands = new ConcurrentLinkedDeque<>();

    @Override
    public String getName() {
        return "memory";
    }

    public void submit(UserCommand command) {
        if (command.getModifiedAt() <= 0) {
            command.setModifiedAt(System.currentTimeMillis());
        }
        commands.addFirst(command);
        while (commands.size() > MAX_RETAINED) {
            commands.pollLast();
        }
        log.info("收到用户命令: {}/{} {}={} by {}", command.getLocationId(), command.getEquipmentId(),
                command.getCommandType(), command.getValue(), command.getModifiedBy());
    }

    @Override
    public List<UserCommand> recentCommands(String locationId, EquipmentType type, Duration lookback, int limit) {
        long since = System.currentTimeMillis() - lookback.toMillis();
        return commands.stream()
                .filter(command -> locationId.equalsIgnoreCase(command.getLocationId()))
                .filter(command -> matchesType(command, type))
                .filter(command -> command.getModifiedAt() >= since)
                .sorted(Comparator.comparingLong(UserCommand::getModifiedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    private boolean matchesType(UserCommand command, EquipmentType type) {
        if (command.getEquipmentType() == null) {
            return false;
        }
        try {
            return EquipmentType.fromCode(command.getEquipmentType()) == type;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
