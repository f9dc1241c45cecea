package com.chih.JXcb.cli;

import com.chih.JXcb.core.engine.CompiledTemplate;
import com.chih.JXcb.core.engine.XcbTemplateEngine;
import com.chih.JXcb.core.exception.XcbException;
import com.chih.JXcb.core.support.GoldenFileSuite;
import com.chih.JXcb.core.support.TemplateText;
import com.chih.JXcb.core.support.TemplateTreePrinter;
import com.chih.JXcb.core.support.VariablesLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * 执行一次命令
 * <ul>
 *   <li>参数是目录：运行黄金文件套件，逐行打印结果，有失败则退出码非 0</li>
 *   <li>参数是文件 (或缺省文件)：渲染后打印到标准输出</li>
 * </ul>
 * 求值失败时记录错误并以非 0 退出码结束。
 *
 * @since 2026/10/19
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class XcbCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final XcbTemplateEngine engine;

    private final CliProperties properties;

    private final PrintStream cliOutput;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getNonOptionArgs());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(List<String> args) {
        if (args.size() > 1) {
            log.warn("Ignoring extra arguments: {}", args.subList(1, args.size()));
        }
        Path target = Paths.get(args.isEmpty() ? properties.getDefaultTemplate() : args.get(0));

        try {
            if (Files.isDirectory(target)) {
                return runSuite(target);
            }
            return renderFile(target);
        } catch (XcbException e) {
            log.error("Rendering {} failed", target, e);
            return EXIT_FAILURE;
        }
    }

    private int runSuite(Path directory) {
        GoldenFileSuite.Report report = new GoldenFileSuite(engine).run(directory);
        report.lines().forEach(cliOutput::println);
        return report.allPassed() ? EXIT_OK : EXIT_FAILURE;
    }

    private int renderFile(Path file) {
        CompiledTemplate template = engine.compile(TemplateText.read(file));
        if (properties.isDumpTree()) {
            cliOutput.print(TemplateTreePrinter.print(template.items()));
        }

        Map<String, Object> variables = properties.getVariables() == null
                ? Map.of()
                : VariablesLoader.load(Paths.get(properties.getVariables()));

        String output = engine.render(template, variables).output();
        cliOutput.println(output);
        return EXIT_OK;
    }
}
