package com.health.config;

import java.time.Clock;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 应用全局配置类
 * <p>
 * 定义整个应用共享的Bean。
 * </p>
 */
@Configuration
@EnableConfigurationProperties(HealthTrendProperties.class)
public class AppConfig {

    /**
     * 提供一个全局可用的 ObjectMapper Bean。
     * <ul>
     *   <li>注册了 {@link JavaTimeModule} 以支持 LocalDateTime 等时间类型。</li>
     *   <li>日期以 ISO 字符串输出 (e.g., "2025-08-21T14:30:00")。</li>
     *   <li>反序列化时忽略未知字段，测量文件可以携带额外信息。</li>
     * </ul>
     *
     * @return 一个配置好的 ObjectMapper 实例
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * "当前时间"的来源，仅影响相对窗口过滤和时效性评分
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
