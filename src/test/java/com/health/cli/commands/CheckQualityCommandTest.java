package com.health.cli.commands;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.health.domain.enums.DataFrequency;
import com.health.domain.enums.MetricType;
import com.health.domain.vo.DataQualityAssessment;
import com.health.domain.vo.DateRange;
import com.health.domain.vo.Measurement;
import com.health.io.MeasurementFileReader;
import com.health.service.TrendAnalyzer;

@ExtendWith(MockitoExtension.class)
@DisplayName("数据质量检查命令测试")
class CheckQualityCommandTest {

    @Mock
    private TrendAnalyzer trendAnalyzer;

    @Mock
    private MeasurementFileReader measurementFileReader;

    @InjectMocks
    private CheckQualityCommand command;

    @Test
    @DisplayName("按指定频率评估质量并查找缺口")
    void testWeeklyFrequency() {
        LocalDateTime start = LocalDateTime.of(2024, 1, 1, 8, 0);
        List<Measurement> measurements = List.of(
                Measurement.of(start, 8000, MetricType.STEPS),
                Measurement.of(start.plusDays(21), 9000, MetricType.STEPS));
        when(measurementFileReader.read(Paths.get("steps.json"), MetricType.STEPS)).thenReturn(measurements);
        when(trendAnalyzer.assessDataQuality(measurements)).thenReturn(DataQualityAssessment.empty());
        when(trendAnalyzer.identifyDataGaps(measurements, DataFrequency.WEEKLY))
                .thenReturn(List.of(DateRange.of(start.plusDays(1), start.plusDays(20))));

        command.execute(new String[]{"--file", "steps.json", "--metric", "STEPS", "--frequency", "weekly"});

        verify(trendAnalyzer).assessDataQuality(measurements);
        verify(trendAnalyzer).identifyDataGaps(measurements, DataFrequency.WEEKLY);
    }

    @Test
    @DisplayName("没有记录时不做评估")
    void testEmptyFile() {
        when(measurementFileReader.read(Paths.get("empty.json"), null)).thenReturn(List.of());

        command.execute(new String[]{"--file", "empty.json"});

        verify(trendAnalyzer, never()).assessDataQuality(anyList());
        verify(trendAnalyzer, never()).identifyDataGaps(anyList(), any());
    }
}
