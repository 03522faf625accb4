package com.health.cli;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * 命令注册器
 * 管理所有CLI命令的注册和查找
 */
@Slf4j
@Component
public class CommandRegistry {

    private final Map<String, Command> commands = new ConcurrentHashMap<>();
    private final Map<String, Command> aliases = new ConcurrentHashMap<>();

    private final List<Command> commandList;

    public CommandRegistry(List<Command> commandList) {
        this.commandList = commandList != null ? commandList : Collections.emptyList();
    }

    @PostConstruct
    public void initialize() {
        for (Command command : commandList) {
            register(command);
        }
        log.info("已注册 {} 个命令，{} 个别名", commands.size(), aliases.size());
    }

    /**
     * 注册命令及其别名，同名时后注册的覆盖先注册的
     */
    public void register(Command command) {
        if (command == null || command.getName() == null || command.getName().isBlank()) {
            log.warn("命令名称为空，忽略: {}", command);
            return;
        }

        String name = command.getName();
        if (commands.containsKey(name)) {
            log.warn("命令名称冲突，覆盖原有命令: {}", name);
        }
        commands.put(name, command);
        log.debug("注册命令: {} -> {}", name, command.getClass().getSimpleName());

        for (String alias : command.getAliases()) {
            if (alias != null && !alias.isBlank()) {
                if (aliases.containsKey(alias)) {
                    log.warn("别名冲突，覆盖原有别名: {} -> {}", alias, name);
                }
                aliases.put(alias, command);
            }
        }
    }

    /**
     * 根据名称或别名获取命令，找不到时返回 null
     */
    public Command getCommand(String name) {
        if (name == null) {
            return null;
        }
        Command command = commands.get(name);
        return command != null ? command : aliases.get(name);
    }

    public Collection<Command> getAllCommands() {
        return new ArrayList<>(commands.values());
    }

    /**
     * 查找以给定前缀开头的命令名和别名（忽略大小写）
     */
    public List<String> findMatchingCommands(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            List<String> all = new ArrayList<>(commands.keySet());
            Collections.sort(all);
            return all;
        }

        String lowerPrefix = prefix.toLowerCase();
        List<String> matches = new ArrayList<>();
        for (String name : commands.keySet()) {
            if (name.toLowerCase().startsWith(lowerPrefix)) {
                matches.add(name);
            }
        }
        for (String alias : aliases.keySet()) {
            if (alias.toLowerCase().startsWith(lowerPrefix) && !matches.contains(alias)) {
                matches.add(alias);
            }
        }
        Collections.sort(matches);
        return matches;
    }

    public void printHelp() {
        System.out.println("健康指标趋势分析 CLI v1.0");
        System.out.println("=====================================");
        System.out.println();
        System.out.println("可用命令:");

        List<Command> sortedCommands = new ArrayList<>(commands.values());
        sortedCommands.sort(Comparator.comparing(Command::getName));
        for (Command command : sortedCommands) {
            String aliasText = command.getAliases().isEmpty()
                    ? ""
                    : " (" + String.join(", ", command.getAliases()) + ")";
            System.out.printf("  %-16s %s%s%n", command.getName(), command.getDescription(), aliasText);
        }

        System.out.println();
        System.out.println("使用示例:");
        System.out.println("  java -jar health-trend-analyzer.jar trend:analyze --file weight.json --range month");
        System.out.println("  java -jar health-trend-analyzer.jar help <command>  # 查看特定命令的帮助");
    }
}
