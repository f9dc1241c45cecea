package com.chih.JXcb.core.engine;

import com.chih.JXcb.core.analyzer.Analyzer;
import com.chih.JXcb.core.domain.Diagnostic;
import com.chih.JXcb.core.domain.DiagnosticKind;
import com.chih.JXcb.core.domain.ErrorPolicy;
import com.chih.JXcb.core.exception.TemplateEvaluationException;
import com.chih.JXcb.core.lexer.Lexer;
import com.chih.JXcb.core.parser.Item;
import com.chih.JXcb.core.parser.Parser;
import com.chih.JXcb.core.spi.ExpressionEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 使用桩求值器测试 Concretizer，求值器只做变量查找
 */
@DisplayName("Concretizer 测试")
class ConcretizerTest {

    /**
     * 表达式即变量名；"boom" 总是失败
     */
    private static class LookupEvaluator implements ExpressionEvaluator {

        final List<String> evaluated = new ArrayList<>();
        final List<String> executed = new ArrayList<>();

        @Override
        public Object evaluate(String expression, Environment environment) {
            evaluated.add(expression);
            if ("boom".equals(expression)) {
                throw new TemplateEvaluationException(expression, "boom");
            }
            return environment.lookup(expression);
        }

        @Override
        public void execute(String statements, Environment environment) {
            executed.add(statements);
        }
    }

    private final LookupEvaluator evaluator = new LookupEvaluator();

    private final Diagnostics diagnostics = new Diagnostics(ErrorPolicy.CONTINUE);

    private Environment environment;

    private Concretizer concretizer;

    private String render(String template, Map<String, ?> vars) {
        List<Item> flat = new Parser(new Lexer(template).lex(), diagnostics).parse();
        List<Item> tree = new Analyzer(flat, diagnostics, false).analyze();
        environment = new Environment(vars);
        concretizer = new Concretizer(evaluator, environment, diagnostics, 8);
        return concretizer.concretize(tree);
    }

    @Test
    @DisplayName("null 值输出为空串")
    void testNullStringified() {
        Map<String, Object> vars = new HashMap<>();
        vars.put("v", null);

        assertThat(render("[#v]", vars)).isEqualTo("[]");
    }

    @Test
    @DisplayName("代码块去除公共缩进后交给求值器执行")
    void testCodeBlockDedented() {
        render("#{\n    a = 1\n      b = 2\n}#", Map.of());

        assertThat(evaluator.executed).containsExactly("\na = 1\n  b = 2\n");
    }

    @Test
    @DisplayName("条件表达式由参数 Token 拼接而成")
    void testConditionJoined() {
        assertThat(render("#(if flag)yes#(end if)", Map.of("flag", true))).isEqualTo("yes");
        assertThat(render("#(if flag)yes#(end if)", Map.of("flag", ""))).isEqualTo("");
        assertThat(evaluator.evaluated).containsOnly("flag");
    }

    @Test
    @DisplayName("for 遍历集合、数组与 Map 的键")
    void testForSources() {
        assertThat(render("#(for x in xs)#x#(end for)", Map.of("xs", List.of("a", "b")))).isEqualTo("ab");
        assertThat(render("#(for x in xs)#x#(end for)", Map.of("xs", new int[]{1, 2}))).isEqualTo("12");
        assertThat(render("#(for x in xs)#x#(end for)", Map.of("xs", Map.of("k", 1)))).isEqualTo("k");
    }

    @Test
    @DisplayName("求值失败时终止渲染，作用域仍被弹出")
    void testFailureUnwindsScopes() {
        assertThatThrownBy(() -> render("#(for i in xs)#boom#(end for)", Map.of("xs", List.of(1))))
                .isInstanceOf(TemplateEvaluationException.class);

        assertThat(environment.depth()).isEqualTo(1);
        assertThat(environment.isBound("i")).isFalse();
    }

    @Test
    @DisplayName("宏参数在调用方作用域中求值")
    void testMacroArgumentsEvaluatedInCaller() {
        String out = render("#(macro show(v))<#v>#(end macro)#(show(a))", Map.of("a", "outer"));

        assertThat(out).isEqualTo("<outer>");
        assertThat(concretizer.getMacros().find("show").parameters()).containsExactly("v");
    }

    @Test
    @DisplayName("非法宏参数报告诊断并被跳过")
    void testInvalidParameter() {
        render("#(macro m(a, 1))x#(end macro)", Map.of());

        assertThat(diagnostics.getEntries()).extracting(Diagnostic::kind)
                .containsExactly(DiagnosticKind.INVALID_PARAMETER);
        assertThat(concretizer.getMacros().find("m").parameters()).containsExactly("a");
    }

    @Test
    @DisplayName("宏名后缺少 ( 时报告诊断")
    void testMacroMissingOpenParen() {
        render("#(macro m x)body#(end macro)", Map.of());

        assertThat(diagnostics.getEntries()).extracting(Diagnostic::kind)
                .containsExactly(DiagnosticKind.EXPECTED_OPEN_PAREN);
        assertThat(concretizer.getMacros().contains("m")).isTrue();
    }

    @Test
    @DisplayName("缺少宏名时不注册")
    void testMacroMissingName() {
        render("#(macro)x#(end macro)", Map.of());

        assertThat(diagnostics.getEntries()).extracting(Diagnostic::kind)
                .containsExactly(DiagnosticKind.MISSING_MACRO_NAME);
        assertThat(concretizer.getMacros().size()).isZero();
    }

    @Test
    @DisplayName("if 缺少条件、for 缺少来源时跳过块体")
    void testMalformedBlocksSkipped() {
        assertThat(render("#(if)x#(end if)#(for i)y#(end for)#(for i in)z#(end for)", Map.of())).isEmpty();

        assertThat(diagnostics.getEntries()).extracting(Diagnostic::kind).containsExactly(
                DiagnosticKind.MISSING_CONDITION, DiagnosticKind.MALFORMED_FOR, DiagnosticKind.MALFORMED_FOR);
    }

    @Test
    @DisplayName("多余的 end 报告诊断")
    void testStrayEnd() {
        assertThat(render("a#(end if)b", Map.of())).isEqualTo("ab");
        assertThat(diagnostics.getEntries()).extracting(Diagnostic::kind)
                .containsExactly(DiagnosticKind.UNKNOWN_BLOCK);
    }

    @Test
    @DisplayName("未定义的指令被忽略")
    void testUnknownDirectiveIgnored() {
        assertThat(render("a#(nothing(1))b", Map.of())).isEqualTo("ab");
        assertThat(diagnostics.isEmpty()).isTrue();
    }
}
