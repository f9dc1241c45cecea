package com.chih.JXcb.core.engine;

import com.chih.JXcb.core.domain.DiagnosticKind;
import com.chih.JXcb.core.exception.TemplateRecursionException;
import com.chih.JXcb.core.lexer.Token;
import com.chih.JXcb.core.lexer.TokenKind;
import com.chih.JXcb.core.parser.BlockDirective;
import com.chih.JXcb.core.parser.CodeBlock;
import com.chih.JXcb.core.parser.Directive;
import com.chih.JXcb.core.parser.Interpolation;
import com.chih.JXcb.core.parser.Item;
import com.chih.JXcb.core.parser.ItemVisitor;
import com.chih.JXcb.core.parser.Text;
import com.chih.JXcb.core.spi.ExpressionEvaluator;
import com.chih.JXcb.core.support.DirectiveArguments;
import com.chih.JXcb.core.support.Indentation;
import com.chih.JXcb.core.support.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 具体化器：深度优先遍历分析后的条目树，生成输出文本
 * <p>
 * 一次渲染对应一个实例。所有表达式与语句都委托给 {@link ExpressionEvaluator}，
 * 求值器抛出的异常不会被捕获，渲染随即终止；结构性问题则交给 {@link Diagnostics}。
 * </p>
 *
 * <h3>作用域：</h3>
 * <ul>
 *   <li>for 循环变量、宏参数绑定在新压入的子作用域中</li>
 *   <li>子作用域总是在 finally 中弹出 (正常结束、提前返回或求值失败)</li>
 * </ul>
 *
 * <h3>提前返回：</h3>
 * <p>
 * 无参数的 {@code #($)} 只终止当前序列：在 if 体内结束该 if 体，在 for 体内结束本轮迭代，
 * 在宏体内结束本次展开，在顶层结束整个渲染。
 * </p>
 *
 * @since 2026/10/19
 */
public class Concretizer implements ItemVisitor<Concretizer.Flow> {

    private static final Logger log = LoggerFactory.getLogger(Concretizer.class);

    public static final String INLINE_EVAL = "$";

    private static final String IN = "in";

    /**
     * 条目执行后的控制流
     */
    public enum Flow {
        CONTINUE,
        RETURN
    }

    private final ExpressionEvaluator evaluator;

    private final Environment environment;

    private final Diagnostics diagnostics;

    private final int maxExpansionDepth;

    private final MacroRegistry macros = new MacroRegistry();

    private final StringBuilder output = new StringBuilder();

    private int expansionDepth;

    public Concretizer(ExpressionEvaluator evaluator, Environment environment,
                       Diagnostics diagnostics, int maxExpansionDepth) {
        this.evaluator = evaluator;
        this.environment = environment;
        this.diagnostics = diagnostics;
        this.maxExpansionDepth = maxExpansionDepth;
    }

    public String concretize(List<Item> items) {
        evaluateSequence(items);
        return output.toString();
    }

    public MacroRegistry getMacros() {
        return macros;
    }

    private void evaluateSequence(List<Item> items) {
        for (Item item : items) {
            if (item.accept(this) == Flow.RETURN) {
                return;
            }
        }
    }

    @Override
    public Flow visitText(Text text) {
        output.append(text.value());
        return Flow.CONTINUE;
    }

    @Override
    public Flow visitInterpolation(Interpolation interpolation) {
        output.append(Values.stringify(evaluate(interpolation.expression())));
        return Flow.CONTINUE;
    }

    @Override
    public Flow visitCodeBlock(CodeBlock codeBlock) {
        evaluator.execute(Indentation.dedent(codeBlock.body()), environment);
        return Flow.CONTINUE;
    }

    @Override
    public Flow visitDirective(Directive directive) {
        String name = directive.name();

        Macro macro = macros.find(name);
        if (macro != null) {
            expandMacro(macro, directive);
        }

        if (INLINE_EVAL.equals(name)) {
            if (directive.args().isEmpty()) {
                return Flow.RETURN;
            }
            output.append(Values.stringify(evaluate(DirectiveArguments.join(directive.args()))));
        } else if (Directive.END.equals(name)) {
            diagnostics.report(DiagnosticKind.UNKNOWN_BLOCK, directive.line(),
                    "'#(end " + DirectiveArguments.join(directive.args()) + ")' has no matching block");
        } else if (macro == null) {
            log.debug("Ignoring directive '{}' at line {}: no macro with this name", name, directive.line());
        }
        return Flow.CONTINUE;
    }

    @Override
    public Flow visitBlockDirective(BlockDirective block) {
        switch (block.name()) {
            case "if" -> evaluateIf(block);
            case "for" -> evaluateFor(block);
            case "macro" -> defineMacro(block);
            default -> diagnostics.report(DiagnosticKind.UNKNOWN_BLOCK, block.line(),
                    "unknown block '" + block.name() + "'");
        }
        return Flow.CONTINUE;
    }

    private void evaluateIf(BlockDirective block) {
        if (block.args().isEmpty()) {
            diagnostics.report(DiagnosticKind.MISSING_CONDITION, block.line(), "'if' requires a condition");
            return;
        }
        if (Values.isTruthy(evaluate(DirectiveArguments.join(block.args())))) {
            evaluateSequence(block.body());
        }
    }

    private void evaluateFor(BlockDirective block) {
        List<Token> args = block.args();
        if (args.size() < 2 || !args.get(0).is(TokenKind.IDENT)) {
            diagnostics.report(DiagnosticKind.MALFORMED_FOR, block.line(),
                    "expected '#(for name in expression)'");
            return;
        }
        if (!IN.equals(args.get(1).text())) {
            diagnostics.report(DiagnosticKind.MISSING_IN, block.line(),
                    "expected 'in', found '" + args.get(1).text() + "'");
        }

        String source = DirectiveArguments.join(args, 2);
        if (source.isBlank()) {
            diagnostics.report(DiagnosticKind.MALFORMED_FOR, block.line(), "'for' requires an iterable expression");
            return;
        }

        String variable = args.get(0).text();
        Iterable<?> elements = Values.toIterable(evaluate(source), source);

        environment.pushScope();
        try {
            for (Object element : elements) {
                environment.bindLocal(variable, element);
                evaluateSequence(block.body());
            }
        } finally {
            environment.popScope();
        }
    }

    /**
     * {@code #(macro name(a, b))}
     */
    private void defineMacro(BlockDirective block) {
        List<Token> args = block.args();
        if (args.isEmpty() || !args.get(0).is(TokenKind.IDENT)) {
            diagnostics.report(DiagnosticKind.MISSING_MACRO_NAME, block.line(), "'macro' requires a name");
            return;
        }

        String name = args.get(0).text();
        List<String> parameters = new ArrayList<>();

        if (args.size() > 1 && !args.get(1).is(TokenKind.OPEN_PAREN)) {
            diagnostics.report(DiagnosticKind.EXPECTED_OPEN_PAREN, block.line(),
                    "expected '(' after macro name '" + name + "'");
        } else if (args.size() > 1) {
            boolean closed = false;
            for (int i = 2; i < args.size(); i++) {
                Token token = args.get(i);
                if (token.is(TokenKind.CLOSE_PAREN)) {
                    closed = true;
                    break;
                }
                if (token.is(TokenKind.IDENT)) {
                    parameters.add(token.text());
                } else if (!token.is(TokenKind.COMMA)) {
                    diagnostics.report(DiagnosticKind.INVALID_PARAMETER, block.line(),
                            "invalid parameter '" + token.text().strip() + "' in macro '" + name + "'");
                }
            }
            if (!closed) {
                diagnostics.report(DiagnosticKind.EXPECTED_CLOSE_PAREN, block.line(),
                        "expected ')' after parameters of macro '" + name + "'");
            }
        }

        macros.register(new Macro(name, parameters, block.body()));
    }

    private void expandMacro(Macro macro, Directive call) {
        List<String> arguments = DirectiveArguments.splitCallArguments(call.args(), diagnostics, call.line());
        List<String> parameters = macro.parameters();

        if (arguments.size() != parameters.size()) {
            diagnostics.report(DiagnosticKind.ARGUMENT_COUNT, call.line(),
                    "macro '" + macro.name() + "' expects " + parameters.size()
                            + " argument(s), got " + arguments.size());
        }

        // 实参全部在调用方作用域中求值后再压栈
        Map<String, Object> bindings = new LinkedHashMap<>();
        int bound = Math.min(arguments.size(), parameters.size());
        for (int i = 0; i < bound; i++) {
            bindings.put(parameters.get(i), evaluate(arguments.get(i)));
        }

        if (expansionDepth >= maxExpansionDepth) {
            throw new TemplateRecursionException("Macro '" + macro.name()
                    + "' exceeded the maximum expansion depth of " + maxExpansionDepth);
        }

        log.debug("Expanding macro '{}' (depth {}) with {}", macro.name(), expansionDepth + 1, bindings.keySet());
        expansionDepth++;
        environment.pushScope(bindings);
        try {
            evaluateSequence(macro.body());
        } finally {
            environment.popScope();
            expansionDepth--;
        }
    }

    private Object evaluate(String expression) {
        return evaluator.evaluate(Indentation.dedent(expression), environment);
    }
}
