package com.health;

import java.util.Arrays;
import java.util.List;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import com.health.cli.Command;
import com.health.cli.CommandException;
import com.health.cli.CommandRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 健康指标趋势分析启动器
 * 无参数时打印系统信息，带参数时执行对应的CLI命令后退出
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class HealthTrendStarter implements CommandLineRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final CommandRegistry commandRegistry;

    public static void main(String[] args) {
        SpringApplication.run(HealthTrendStarter.class, args);
    }

    @Override
    public void run(String... args) {
        if (args.length == 0) {
            printSystemInfo();
            return;
        }
        // CLI命令执行完成后退出应用
        System.exit(dispatch(args));
    }

    /**
     * 解析并执行命令
     *
     * @return 进程退出码
     */
    int dispatch(String[] args) {
        String commandName = args[0];

        if ("help".equals(commandName) || "--help".equals(commandName) || "-h".equals(commandName)) {
            if (args.length > 1) {
                return showCommandHelp(args[1]);
            }
            commandRegistry.printHelp();
            return EXIT_OK;
        }

        Command command = commandRegistry.getCommand(commandName);
        if (command == null) {
            System.err.println("❌ 未知命令: " + commandName);
            System.err.println("💡 使用 'help' 查看可用命令列表");
            suggestSimilarCommands(commandName);
            return EXIT_FAILURE;
        }

        try {
            command.execute(Arrays.copyOfRange(args, 1, args.length));
            return EXIT_OK;
        } catch (CommandException e) {
            System.err.println("❌ " + e.getMessage());
            if (isDebugMode(args)) {
                e.printStackTrace();
            }
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            System.err.println("❌ 系统错误: " + e.getMessage());
            log.error("命令执行异常", e);
            return EXIT_FAILURE;
        }
    }

    private void printSystemInfo() {
        System.out.println("=====================================");
        System.out.println("📈 健康指标趋势分析 v1.0");
        System.out.println("=====================================");
        System.out.println("支持指标: 体重 / 步数 / 卡路里 / 心率 / 血糖");
        System.out.println("功能: 趋势分析、异常检测、离群值检测、数据质量评估、趋势预测");
        System.out.println();
        System.out.println("💡 可用命令:");
        commandRegistry.getAllCommands().stream()
                .sorted((c1, c2) -> c1.getName().compareTo(c2.getName()))
                .forEach(cmd -> System.out.printf("  %-16s %s%n", cmd.getName(), cmd.getDescription()));
        System.out.println();
        System.out.println("🔗 获取帮助: java -jar health-trend-analyzer.jar help [command]");
        System.out.println("=====================================");
    }

    private int showCommandHelp(String commandName) {
        Command command = commandRegistry.getCommand(commandName);
        if (command == null) {
            System.err.println("❌ 未知命令: " + commandName);
            suggestSimilarCommands(commandName);
            return EXIT_FAILURE;
        }
        command.printUsage();
        return EXIT_OK;
    }

    private void suggestSimilarCommands(String input) {
        List<String> suggestions = commandRegistry.findMatchingCommands(input);
        if (!suggestions.isEmpty()) {
            System.out.println();
            System.out.println("🤔 您是否想要执行以下命令之一？");
            suggestions.stream()
                    .limit(3)
                    .forEach(cmd -> System.out.println("  " + cmd));
        }
    }

    private boolean isDebugMode(String[] args) {
        return Arrays.stream(args).anyMatch(arg -> "--debug".equals(arg) || "-v".equals(arg));
    }
}
