package com.health.cli.commands;

import java.nio.file.Path;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.springframework.stereotype.Component;

import com.health.cli.AbstractCommand;
import com.health.cli.CommandException;
import com.health.domain.enums.DataFrequency;
import com.health.domain.enums.MetricType;
import com.health.domain.vo.DataQualityAssessment;
import com.health.domain.vo.DateRange;
import com.health.domain.vo.Measurement;
import com.health.io.MeasurementFileException;
import com.health.io.MeasurementFileReader;
import com.health.service.TrendAnalyzer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 数据质量与缺口检查命令
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckQualityCommand extends AbstractCommand {

    private final TrendAnalyzer trendAnalyzer;
    private final MeasurementFileReader measurementFileReader;

    @Override
    public String getName() {
        return "quality:check";
    }

    @Override
    public String getDescription() {
        return "评估测量数据的完整性、一致性、准确性和时效性";
    }

    @Override
    public List<String> getAliases() {
        return List.of("check-quality");
    }

    @Override
    public List<String> getExamples() {
        return List.of(
                "quality:check --file weight.json",
                "quality:check --file steps.json --metric STEPS --frequency weekly"
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
        DataFrequency frequency = getEnumOptionValue(cmd, "frequency", DataFrequency::fromName, DataFrequency.DAILY);

        try {
            List<Measurement> measurements = measurementFileReader.read(file, metricType);
            printInfo(String.format("开始检查 %s (%d 条记录, 期望频率: %s)",
                    file, measurements.size(), frequency.getDisplayName()));

            printTableHeader("数据质量报告");
            if (measurements.isEmpty()) {
                printWarning("文件中没有可用的测量记录，无法生成质量报告。");
                return;
            }
            DataQualityAssessment assessment = trendAnalyzer.assessDataQuality(measurements);
            System.out.print(assessment.getChineseSummary());

            printTableHeader("数据缺口");
            List<DateRange> gaps = trendAnalyzer.identifyDataGaps(measurements, frequency);
            if (gaps.isEmpty()) {
                printInfo(frequency.isRegular() ? "未发现数据缺口" : "不规则频率不做缺口检查");
            } else {
                for (DateRange gap : gaps) {
                    System.out.printf("%s ~ %s%n", gap.start().toLocalDate(), gap.end().toLocalDate());
                }
                printWarning(String.format("共发现 %d 处数据缺口", gaps.size()));
            }

            printSeparator();
            printSuccess("数据质量检查完成。");

        } catch (MeasurementFileException e) {
            log.error("数据质量检查命令执行失败: {}", e.getMessage());
            throw CommandException.executionFailed(getName(), e.getMessage(), e);
        }
    }

    @Override
    protected Options createOptions() {
        Options options = createBaseOptions();
        options.addOption(createOption("m", "metric", "只检查指定指标，例如 WEIGHT、STEPS", true));
        options.addOption(createOption("q", "frequency", "期望采集频率: daily|weekly|monthly|irregular (默认 daily)", true));
        return options;
    }
}
