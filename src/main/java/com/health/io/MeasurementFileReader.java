package com.health.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.health.domain.enums.MetricType;
import com.health.domain.vo.Measurement;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 从JSON文件读取测量记录
 * <p>
 * 文件内容为对象数组，例如
 * {@code [{"timestamp":"2024-01-01T08:00:00","value":70.2,"metricType":"WEIGHT"}]}。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MeasurementFileReader {

    private static final TypeReference<List<Measurement>> MEASUREMENT_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public List<Measurement> read(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new MeasurementFileException("测量文件不存在: " + file);
        }

        try {
            List<Measurement> measurements = objectMapper.readValue(file.toFile(), MEASUREMENT_LIST);
            if (measurements == null) {
                throw new MeasurementFileException("测量文件内容为空: " + file);
            }
            log.info("读取测量文件完成: file={}, records={}", file, measurements.size());
            return measurements;
        } catch (IOException e) {
            throw new MeasurementFileException("无法解析测量文件 " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * 读取文件并只保留指定指标的记录；metricType 为 null 时不过滤
     */
    public List<Measurement> read(Path file, MetricType metricType) {
        List<Measurement> measurements = read(file);
        if (metricType == null) {
            return measurements;
        }
        List<Measurement> filtered = measurements.stream()
                .filter(m -> m.getMetricType() == metricType)
                .collect(Collectors.toList());
        log.debug("按指标过滤: metricType={}, before={}, after={}", metricType, measurements.size(), filtered.size());
        return filtered;
    }
}
