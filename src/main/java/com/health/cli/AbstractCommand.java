package com.health.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * 抽象命令基类
 * 提供命令行参数解析、取值转换和彩色控制台输出
 */
public abstract class AbstractCommand implements Command {

    protected static final String ANSI_RESET = "\u001B[0m";
    protected static final String ANSI_GREEN = "\u001B[32m";
    protected static final String ANSI_RED = "\u001B[31m";
    protected static final String ANSI_YELLOW = "\u001B[33m";
    protected static final String ANSI_CYAN = "\u001B[36m";
    protected static final String ANSI_BOLD = "\u001B[1m";

    /**
     * 当前命令的选项定义
     */
    protected abstract Options createOptions();

    /**
     * 解析命令行参数
     * @throws CommandException 解析失败时抛出异常
     */
    protected CommandLine parseArgs(String[] args, Options options) throws CommandException {
        CommandLineParser parser = new DefaultParser();
        try {
            return parser.parse(options, args);
        } catch (ParseException e) {
            throw CommandException.invalidArgument(getName(), e.getMessage());
        }
    }

    /**
     * 获取测量文件路径，--file 为必需参数
     */
    protected Path getFileOption(CommandLine cmd) {
        if (!cmd.hasOption("file")) {
            throw CommandException.missingRequired(getName(), "--file");
        }
        return Paths.get(cmd.getOptionValue("file"));
    }

    /**
     * 获取整数选项值，如果不存在则返回默认值
     */
    protected int getIntOptionValue(CommandLine cmd, String option, int defaultValue) {
        if (!cmd.hasOption(option)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(cmd.getOptionValue(option));
        } catch (NumberFormatException e) {
            throw CommandException.invalidArgument(getName(), "选项 --" + option + " 必须是数字");
        }
    }

    /**
     * 获取日期选项值 (yyyy-MM-dd)，不存在时返回 null
     */
    protected LocalDate getDateOptionValue(CommandLine cmd, String option) {
        if (!cmd.hasOption(option)) {
            return null;
        }
        try {
            return LocalDate.parse(cmd.getOptionValue(option));
        } catch (DateTimeParseException e) {
            throw CommandException.invalidArgument(getName(), "选项 --" + option + " 必须是 yyyy-MM-dd 格式的日期");
        }
    }

    /**
     * 按名称解析枚举选项，不存在时返回默认值
     */
    protected <T> T getEnumOptionValue(CommandLine cmd, String option, Function<String, T> parser, T defaultValue) {
        if (!cmd.hasOption(option)) {
            return defaultValue;
        }
        try {
            return parser.apply(cmd.getOptionValue(option));
        } catch (IllegalArgumentException e) {
            throw CommandException.invalidArgument(getName(), e.getMessage());
        }
    }

    protected boolean shouldShowHelp(CommandLine cmd) {
        return cmd.hasOption("help");
    }

    protected void printSuccess(String message) {
        System.out.println(ANSI_GREEN + "✅ " + message + ANSI_RESET);
    }

    protected void printError(String message) {
        System.err.println(ANSI_RED + "❌ " + message + ANSI_RESET);
    }

    protected void printWarning(String message) {
        System.out.println(ANSI_YELLOW + "⚠️  " + message + ANSI_RESET);
    }

    protected void printInfo(String message) {
        System.out.println(ANSI_CYAN + "ℹ️  " + message + ANSI_RESET);
    }

    protected void printTableHeader(String title) {
        System.out.println();
        System.out.println(ANSI_BOLD + "=== " + title + " ===" + ANSI_RESET);
    }

    protected void printSeparator() {
        System.out.println("─────────────────────────────────────────────────────────────");
    }

    /**
     * 所有命令共享的选项：帮助和测量文件
     */
    protected Options createBaseOptions() {
        Options options = new Options();
        options.addOption("h", "help", false, "显示帮助信息");
        options.addOption(createOption("f", "file", "测量记录JSON文件 (必需)", true));
        return options;
    }

    protected Option createOption(String shortName, String longName, String description, boolean hasArg) {
        return Option.builder(shortName)
                .longOpt(longName)
                .desc(description)
                .hasArg(hasArg)
                .build();
    }

    protected void printUsageHeader(String usage) {
        System.out.println(ANSI_BOLD + "用法:" + ANSI_RESET);
        System.out.println("  " + usage);
        System.out.println();
    }

    protected void printOptions(Options options) {
        System.out.println(ANSI_BOLD + "选项:" + ANSI_RESET);
        HelpFormatter formatter = new HelpFormatter();
        formatter.printOptions(new PrintWriter(System.out, true), 80, options, 2, 2);
        System.out.println();
    }

    protected void printExamples() {
        List<String> examples = getExamples();
        if (!examples.isEmpty()) {
            System.out.println(ANSI_BOLD + "示例:" + ANSI_RESET);
            for (String example : examples) {
                System.out.println("  " + example);
            }
            System.out.println();
        }
    }

    @Override
    public void printUsage() {
        printUsageHeader("java -jar health-trend-analyzer.jar " + getName() + " [选项]");
        System.out.println(ANSI_BOLD + "描述:" + ANSI_RESET);
        System.out.println("  " + getDescription());
        System.out.println();
        printOptions(createOptions());
        printExamples();
    }
}
