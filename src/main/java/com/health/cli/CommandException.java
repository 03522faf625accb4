package com.health.cli;

/**
 * 命令执行异常
 * 用于包装命令执行过程中的参数错误和分析失败
 */
public class CommandException extends RuntimeException {

    private final String commandName;

    public CommandException(String message) {
        super(message);
        this.commandName = null;
    }

    public CommandException(String commandName, String message) {
        super(String.format("命令 '%s' 执行失败: %s", commandName, message));
        this.commandName = commandName;
    }

    public CommandException(String commandName, String message, Throwable cause) {
        super(String.format("命令 '%s' 执行失败: %s", commandName, message), cause);
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }

    /**
     * 参数解析错误
     */
    public static CommandException invalidArgument(String commandName, String message) {
        return new CommandException(commandName, "参数错误: " + message);
    }

    /**
     * 缺少必需参数
     */
    public static CommandException missingRequired(String commandName, String paramName) {
        return new CommandException(commandName, "缺少必需参数: " + paramName);
    }

    /**
     * 命令执行失败（带异常）
     */
    public static CommandException executionFailed(String commandName, String message, Throwable cause) {
        return new CommandException(commandName, "执行失败: " + message, cause);
    }
}
