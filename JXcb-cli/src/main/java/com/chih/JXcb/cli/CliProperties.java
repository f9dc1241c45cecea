package com.chih.JXcb.cli;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 命令行配置 (j-xcb.cli.*)
 *
 * @since 2026/10/19
 */
@Data
@ConfigurationProperties(prefix = "j-xcb.cli")
public class CliProperties {

    public static final String DEFAULT_TEMPLATE = "macro.txt.xcb";

    /**
     * 未给出位置参数时渲染的文件
     */
    private String defaultTemplate = DEFAULT_TEMPLATE;

    /**
     * 渲染前先打印分析后的条目树
     */
    private boolean dumpTree = false;

    /**
     * 预置变量的 YAML / JSON 文件
     */
    private String variables;
}
