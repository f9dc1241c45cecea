package com.chih.JXcb.core.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JXcb ObjectMapper 工厂类
 * <p>
 * 变量文件 (YAML / JSON) 统一使用这里创建的映射器，保证两种格式的解析行为一致。
 * </p>
 *
 * <h3>配置策略说明：</h3>
 * <ul>
 *   <li>FAIL_ON_UNKNOWN_PROPERTIES: false</li>
 *   <li>USE_BIG_DECIMAL_FOR_FLOATS: false - 小数解析为 Double，便于表达式直接运算</li>
 *   <li>WRITE_DATES_AS_TIMESTAMPS: disabled - 日期使用 ISO-8601 格式</li>
 * </ul>
 *
 * @since 2026/10/19
 */
public final class XcbObjectMapperFactory {

    private XcbObjectMapperFactory() {
    }

    /**
     * 创建用于 YAML 解析的 ObjectMapper
     *
     * @return 配置好的 YAML ObjectMapper，线程安全可重用
     */
    public static ObjectMapper createYamlMapper() {
        return configure(new ObjectMapper(new YAMLFactory()));
    }

    /**
     * 创建用于 JSON 解析的 ObjectMapper，与 YAML 映射器保持一致的配置策略
     */
    public static ObjectMapper createJsonMapper() {
        return configure(new ObjectMapper());
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        /* 注册 Java 8 时间模块，支持 LocalDate 等时间类型 */
        mapper.registerModule(new JavaTimeModule());

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, false);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        return mapper;
    }
}
