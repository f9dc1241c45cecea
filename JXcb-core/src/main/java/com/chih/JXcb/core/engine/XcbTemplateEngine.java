package com.chih.JXcb.core.engine;

import com.chih.JXcb.core.analyzer.Analyzer;
import com.chih.JXcb.core.domain.Diagnostic;
import com.chih.JXcb.core.domain.RenderOptions;
import com.chih.JXcb.core.impl.JexlExpressionEvaluator;
import com.chih.JXcb.core.lexer.Lexer;
import com.chih.JXcb.core.lexer.Token;
import com.chih.JXcb.core.parser.Item;
import com.chih.JXcb.core.parser.Parser;
import com.chih.JXcb.core.spi.ExpressionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 模板引擎门面
 * <p>
 * 串联 Lexer → Parser → Analyzer → Concretizer 四个阶段。
 * 引擎本身无状态，可被多个线程共享；单次渲染内部是单线程的。
 * </p>
 *
 * <h3>使用示例：</h3>
 * <pre>{@code
 * XcbTemplateEngine engine = new XcbTemplateEngine();
 * String out = engine.render("#(for i in range(3))#i#(end for)", Map.of()).output(); // "012"
 * }</pre>
 *
 * @since 2026/10/19
 */
public class XcbTemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(XcbTemplateEngine.class);

    private final ExpressionEvaluator evaluator;

    private final RenderOptions options;

    public XcbTemplateEngine() {
        this(new JexlExpressionEvaluator(), RenderOptions.defaults());
    }

    public XcbTemplateEngine(ExpressionEvaluator evaluator, RenderOptions options) {
        this.evaluator = evaluator;
        this.options = options;
    }

    /**
     * 编译模板：词法分析、解析、块结构分析
     *
     * @throws com.chih.JXcb.core.exception.TemplateSyntaxException 错误策略为 ABORT 且存在结构性错误
     */
    public CompiledTemplate compile(String source) {
        Diagnostics diagnostics = new Diagnostics(options.getErrorPolicy());

        List<Token> tokens = new Lexer(source, options.isTrimDirectiveLines()).lex();
        List<Item> flat = new Parser(tokens, diagnostics).parse();
        List<Item> tree = new Analyzer(flat, diagnostics, options.isReportUnterminatedBlocks()).analyze();

        log.debug("Compiled template: {} tokens, {} items, {} top-level nodes, {} diagnostics",
                tokens.size(), flat.size(), tree.size(), diagnostics.getEntries().size());
        return new CompiledTemplate(tree, diagnostics.getEntries());
    }

    /**
     * 渲染已编译的模板
     *
     * @param variables 初始变量，放入根作用域；可为 null
     * @throws com.chih.JXcb.core.exception.TemplateEvaluationException 求值器拒绝表达式
     * @throws com.chih.JXcb.core.exception.TemplateRecursionException  宏展开过深
     */
    public RenderResult render(CompiledTemplate template, Map<String, ?> variables) {
        Environment environment = new Environment(variables == null ? Collections.emptyMap() : variables);
        Diagnostics diagnostics = new Diagnostics(options.getErrorPolicy());

        Concretizer concretizer = new Concretizer(evaluator, environment, diagnostics, options.getMaxExpansionDepth());
        String output = concretizer.concretize(template.items());

        List<Diagnostic> all = new ArrayList<>(template.diagnostics());
        all.addAll(diagnostics.getEntries());
        return new RenderResult(output, all, environment.rootVariables());
    }

    public RenderResult render(String source, Map<String, ?> variables) {
        return render(compile(source), variables);
    }

    public RenderOptions getOptions() {
        return options;
    }

    public ExpressionEvaluator getEvaluator() {
        return evaluator;
    }
}
