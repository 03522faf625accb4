package com.health.cli.commands;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.springframework.stereotype.Component;

import com.health.cli.AbstractCommand;
import com.health.cli.CommandException;
import com.health.common.utils.NumberFormatUtils;
import com.health.domain.enums.MetricType;
import com.health.domain.enums.OutlierDetectionMethod;
import com.health.domain.vo.Measurement;
import com.health.io.MeasurementFileException;
import com.health.io.MeasurementFileReader;
import com.health.service.TrendAnalyzer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 离群值检测命令
 * 记录按时间排序后检测，输出离群值的下标、时间和数值
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DetectOutlierCommand extends AbstractCommand {

    private final TrendAnalyzer trendAnalyzer;
    private final MeasurementFileReader measurementFileReader;

    @Override
    public String getName() {
        return "outlier:detect";
    }

    @Override
    public String getDescription() {
        return "使用Z分数、IQR或修正Z分数检测离群值";
    }

    @Override
    public List<String> getAliases() {
        return List.of("outliers");
    }

    @Override
    public List<String> getExamples() {
        return List.of(
                "outlier:detect --file heart_rate.json",
                "outlier:detect --file glucose.json --method modified-z-score"
        );
    }

    @Override
    public void execute(String[] args) throws CommandException {
        CommandLine cmd = parseArgs(args, createOptions());
        if (shouldShowHelp(cmd)) {
            printUsage();
            return;
        }

        Path file = getFileOption(cmd);
        MetricType metricType = getEnumOptionValue(cmd, "metric", MetricType::fromName, null);
        OutlierDetectionMethod method = getEnumOptionValue(cmd, "method",
                OutlierDetectionMethod::fromCode, OutlierDetectionMethod.Z_SCORE);

        try {
            List<Measurement> sorted = measurementFileReader.read(file, metricType).stream()
                    .sorted(Comparator.comparing(Measurement::getTimestamp))
                    .collect(Collectors.toList());
            List<Double> values = sorted.stream().map(Measurement::getValue).collect(Collectors.toList());

            printInfo(String.format("开始检测 %s (%d 条记录, 方法: %s)", file, values.size(), method.getDisplayName()));
            List<Integer> outliers = trendAnalyzer.detectOutliers(values, method);

            printTableHeader("离群值");
            if (outliers.isEmpty()) {
                printInfo(values.size() < 3 ? "记录少于3条，不做离群值检测" : "未检测到离群值");
            } else {
                for (int index : outliers) {
                    Measurement measurement = sorted.get(index);
                    System.out.printf("#%-4d %s  %s%n", index, measurement.getTimestamp(),
                            NumberFormatUtils.scale(measurement.getValue()));
                }
                printWarning(String.format("共检测到 %d 个离群值", outliers.size()));
            }

            printSeparator();
            printSuccess("离群值检测完成。");

        } catch (MeasurementFileException e) {
            log.error("离群值检测命令执行失败: {}", e.getMessage());
            throw CommandException.executionFailed(getName(), e.getMessage(), e);
        }
    }

    @Override
    protected Options createOptions() {
        Options options = createBaseOptions();
        options.addOption(createOption("m", "metric", "只检测指定指标，例如 HEART_RATE", true));
        options.addOption(createOption("d", "method", "检测方法: z-score|iqr|modified-z-score|isolation (默认 z-score)", true));
        return options;
    }
}
