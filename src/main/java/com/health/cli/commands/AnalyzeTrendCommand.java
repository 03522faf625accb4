package com.health.cli.commands;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.springframework.stereotype.Component;

import com.health.analysis.TrendClassifier;
import com.health.cli.AbstractCommand;
import com.health.cli.CommandException;
import com.health.common.utils.NumberFormatUtils;
import com.health.domain.enums.MetricType;
import com.health.domain.enums.TimeRange;
import com.health.domain.vo.AnomalyPoint;
import com.health.domain.vo.DateRange;
import com.health.domain.vo.Measurement;
import com.health.domain.vo.TimeWindow;
import com.health.domain.vo.TrendAnalysis;
import com.health.domain.vo.TrendPoint;
import com.health.domain.vo.TrendPrediction;
import com.health.domain.vo.TrendSummary;
import com.health.exception.TrendAnalysisException;
import com.health.io.MeasurementFileException;
import com.health.io.MeasurementFileReader;
import com.health.service.TrendAnalyzer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 趋势分析命令
 * 读取测量文件，输出汇总统计、趋势方向、强度、异常点和可选的预测
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalyzeTrendCommand extends AbstractCommand {

    private final TrendAnalyzer trendAnalyzer;
    private final TrendClassifier trendClassifier;
    private final MeasurementFileReader measurementFileReader;

    @Override
    public String getName() {
        return "trend:analyze";
    }

    @Override
    public String getDescription() {
        return "分析测量序列的趋势方向、强度和异常点";
    }

    @Override
    public List<String> getAliases() {
        return List.of("analyze");
    }

    @Override
    public List<String> getExamples() {
        return List.of(
                "trend:analyze --file weight.json --range month",
                "trend:analyze --file data.json --metric HEART_RATE --from 2024-01-01 --to 2024-03-31",
                "trend:analyze --file weight.json --range quarter --predict 7"
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
        int predictDays = getIntOptionValue(cmd, "predict", 0);
        if (cmd.hasOption("predict") && predictDays <= 0) {
            throw CommandException.invalidArgument(getName(), "--predict 必须为正整数");
        }
        TimeWindow window = resolveWindow(cmd);
        String label = window.isExplicit()
                ? window.getDateRange().start().toLocalDate() + " ~ " + window.getDateRange().end().toLocalDate()
                : getEnumOptionValue(cmd, "range", TimeRange::fromName, TimeRange.MONTH).getDisplayName();

        try {
            List<Measurement> measurements = measurementFileReader.read(file, metricType);
            printInfo(String.format("开始分析 %s (%d 条记录, 时间范围: %s)", file, measurements.size(), label));

            TrendAnalysis analysis = trendAnalyzer.analyzeTrends(measurements, window);
            double strength = trendAnalyzer.calculateTrendStrength(analysis);

            printSummary(analysis);
            printTableHeader("趋势判断");
            System.out.printf("方向: %s  斜率: %s  相关系数: %s%n",
                    analysis.getDirection().getDisplayName(),
                    NumberFormatUtils.scale(analysis.getSlope(), 4),
                    NumberFormatUtils.scale(analysis.getCorrelation(), 4));
            System.out.printf("强度: %s  置信度: %s%n",
                    NumberFormatUtils.percent(strength), NumberFormatUtils.percent(analysis.getConfidence()));
            System.out.println(trendClassifier.describeTrend(analysis.getDirection(), strength,
                    analysis.getConfidence(), label));

            printAnomalies(analysis.getAnomalies());

            if (predictDays > 0) {
                printPrediction(trendAnalyzer.predictTrend(analysis, predictDays));
            }

            printSeparator();
            printSuccess("趋势分析完成。");

        } catch (TrendAnalysisException | MeasurementFileException e) {
            log.error("趋势分析命令执行失败: {}", e.getMessage());
            throw CommandException.executionFailed(getName(), e.getMessage(), e);
        }
    }

    @Override
    protected Options createOptions() {
        Options options = createBaseOptions();
        options.addOption(createOption("r", "range", "相对时间范围: week|month|quarter|year (默认 month)", true));
        options.addOption(createOption(null, "from", "显式开始日期 (yyyy-MM-dd)，需与 --to 同时使用", true));
        options.addOption(createOption(null, "to", "显式结束日期 (yyyy-MM-dd)，包含当天", true));
        options.addOption(createOption("m", "metric", "只分析指定指标，例如 WEIGHT、HEART_RATE", true));
        options.addOption(createOption("p", "predict", "向后预测的天数", true));
        return options;
    }

    private TimeWindow resolveWindow(CommandLine cmd) {
        LocalDate from = getDateOptionValue(cmd, "from");
        LocalDate to = getDateOptionValue(cmd, "to");
        if (from == null && to == null) {
            return TimeWindow.of(getEnumOptionValue(cmd, "range", TimeRange::fromName, TimeRange.MONTH));
        }
        if (from == null || to == null) {
            throw CommandException.invalidArgument(getName(), "--from 与 --to 必须同时指定");
        }
        if (cmd.hasOption("range")) {
            throw CommandException.invalidArgument(getName(), "--range 不能与 --from/--to 同时使用");
        }
        try {
            return TimeWindow.between(DateRange.of(from.atStartOfDay(), to.atTime(LocalTime.MAX)));
        } catch (TrendAnalysisException e) {
            throw CommandException.invalidArgument(getName(), e.getMessage());
        }
    }

    private void printSummary(TrendAnalysis analysis) {
        TrendSummary summary = analysis.getSummary();
        printTableHeader("汇总统计 (" + analysis.getDataType().getDisplayName() + ")");
        System.out.printf("记录数: %d  均值: %s  标准差: %s%n",
                summary.getTotalDataPoints(),
                NumberFormatUtils.scale(summary.getAverageValue()),
                NumberFormatUtils.scale(summary.getStandardDeviation()));
        System.out.printf("最小值: %s  最大值: %s  首值: %s  末值: %s  变化: %s%%%n",
                NumberFormatUtils.scale(summary.getMinimumValue()),
                NumberFormatUtils.scale(summary.getMaximumValue()),
                NumberFormatUtils.scale(summary.getFirstValue()),
                NumberFormatUtils.scale(summary.getLastValue()),
                NumberFormatUtils.scale(summary.getChangePercentage()));
    }

    private void printAnomalies(List<AnomalyPoint> anomalies) {
        printTableHeader("异常点");
        if (anomalies.isEmpty()) {
            printInfo("未检测到异常点");
            return;
        }
        for (AnomalyPoint anomaly : anomalies) {
            System.out.printf("%s  值: %s  期望: %s  Z分数: %s  严重程度: %s%n",
                    anomaly.getTimestamp(),
                    NumberFormatUtils.scale(anomaly.getValue()),
                    NumberFormatUtils.scale(anomaly.getExpectedValue()),
                    NumberFormatUtils.scale(anomaly.getDeviationScore()),
                    anomaly.getSeverity().getDisplayName());
        }
        printWarning(String.format("共检测到 %d 个异常点", anomalies.size()));
    }

    private void printPrediction(TrendPrediction prediction) {
        printTableHeader("趋势预测 (" + prediction.getMethodology() + ")");
        for (TrendPoint point : prediction.getPredictedPoints()) {
            System.out.printf("%s  %s%n", point.getTimestamp().toLocalDate(), NumberFormatUtils.scale(point.getValue()));
        }
        System.out.printf("置信度: %s  有效期至: %s%n",
                NumberFormatUtils.percent(prediction.getConfidence()), prediction.getValidUntil());
    }
}
