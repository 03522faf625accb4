package com.health.service;

import java.util.List;

import com.health.domain.enums.DataFrequency;
import com.health.domain.vo.DataQualityAssessment;
import com.health.domain.vo.DateRange;
import com.health.domain.vo.Measurement;

/**
 * 数据质量服务接口
 * 提供数据质量评分和数据缺口识别
 */
public interface DataQualityService {

    /**
     * 评估测量序列的数据质量
     * <p>
     * 评分维度包括：
     * - 完整性：仅考虑已存在的记录，恒为1.0
     * - 一致性：1 - Z分数离群值占比
     * - 准确性：1 - 超出指标合理范围的记录占比
     * - 时效性：max(0, 1 - 距最新记录天数/30)
     * 综合得分为四项的算术平均。
     * </p>
     *
     * @param measurements 测量序列
     * @return 质量评估，空输入时全部为0且无问题项
     */
    DataQualityAssessment assessDataQuality(List<Measurement> measurements);

    /**
     * 查找数据缺口
     * <p>
     * 相邻记录间隔超过预期间隔1.5倍时报告一个缺口，
     * 缺口为两条记录之间（不含两端）的时间段。不定期采集不报告缺口。
     * </p>
     *
     * @param measurements      测量序列，无需预先排序
     * @param expectedFrequency 预期采集频率
     * @return 数据缺口列表
     */
    List<DateRange> identifyDataGaps(List<Measurement> measurements, DataFrequency expectedFrequency);
}
