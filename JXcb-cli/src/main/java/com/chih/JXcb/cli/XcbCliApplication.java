package com.chih.JXcb.cli;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.io.PrintStream;

/**
 * 命令行入口
 * <pre>
 * java -jar JXcb-cli.jar [template-file | golden-directory]
 * </pre>
 *
 * @since 2026/10/19
 */
@SpringBootApplication
@EnableConfigurationProperties(CliProperties.class)
public class XcbCliApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(XcbCliApplication.class, args)));
    }

    /**
     * 渲染结果只写到标准输出，日志走标准错误
     */
    @Bean
    public PrintStream cliOutput() {
        return System.out;
    }
}
