package com.chih.JXcb.core.support;

import com.chih.JXcb.core.exception.XcbException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 从 YAML / JSON 文件加载初始变量
 * <p>
 * 文件顶层必须是映射；{@code .json} 后缀使用 JSON 解析，其余按 YAML 解析。
 * 空文件得到空映射。
 * </p>
 *
 * <pre>{@code
 * # vars.yaml
 * title: Report
 * items: [a, b, c]
 * }</pre>
 *
 * @since 2026/10/19
 */
public final class VariablesLoader {

    private static final Logger log = LoggerFactory.getLogger(VariablesLoader.class);

    private static final ObjectMapper YAML_MAPPER = XcbObjectMapperFactory.createYamlMapper();
    private static final ObjectMapper JSON_MAPPER = XcbObjectMapperFactory.createJsonMapper();

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private VariablesLoader() {
    }

    /**
     * @throws XcbException 文件无法读取、格式错误或顶层不是映射
     */
    public static Map<String, Object> load(Path path) {
        ObjectMapper mapper = path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")
                ? JSON_MAPPER : YAML_MAPPER;

        JsonNode root;
        try {
            root = mapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new XcbException("Failed to load variables from " + path, e);
        }

        if (root == null || root.isMissingNode() || root.isNull()) {
            return Collections.emptyMap();
        }
        if (!root.isObject()) {
            throw new XcbException("Variables file must contain a mapping at the top level: " + path);
        }

        Map<String, Object> variables = mapper.convertValue(root, MAP_TYPE);
        log.debug("Loaded {} variable(s) from {}", variables.size(), path);
        return variables;
    }
}
