package com.chih.JXcb.core.support;

import com.chih.JXcb.core.domain.Diagnostic;
import com.chih.JXcb.core.domain.DiagnosticKind;
import com.chih.JXcb.core.domain.ErrorPolicy;
import com.chih.JXcb.core.engine.Diagnostics;
import com.chih.JXcb.core.lexer.Lexer;
import com.chih.JXcb.core.lexer.Token;
import com.chih.JXcb.core.parser.Directive;
import com.chih.JXcb.core.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("DirectiveArguments 测试")
class DirectiveArgumentsTest {

    private final Diagnostics diagnostics = new Diagnostics(ErrorPolicy.CONTINUE);

    private List<Token> argsOf(String directive) {
        Directive parsed = (Directive) new Parser(new Lexer(directive).lex(), diagnostics).parse().get(0);
        return parsed.args();
    }

    @Test
    @DisplayName("拼接时原样补回被丢弃的空白")
    void testJoin() {
        assertThat(DirectiveArguments.join(argsOf("#(if a and not b)"))).isEqualTo("a and not b");
        assertThat(DirectiveArguments.join(argsOf("#(if a  and\tb)"))).isEqualTo("a  and\tb");
        assertThat(DirectiveArguments.join(argsOf("#(for i in range(3))"), 2)).isEqualTo("range(3)");
    }

    @Test
    @DisplayName("按顶层逗号切分实参")
    void testSplit() {
        List<String> args = DirectiveArguments.splitCallArguments(argsOf("#(m(f(a, b), c))"), diagnostics, 1);

        assertThat(args).containsExactly("f(a, b)", "c");
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("() 与无参数都表示零个实参")
    void testEmpty() {
        assertThat(DirectiveArguments.splitCallArguments(argsOf("#(m())"), diagnostics, 1)).isEmpty();
        assertThat(DirectiveArguments.splitCallArguments(argsOf("#(m)"), diagnostics, 1)).isEmpty();
    }

    @Test
    @DisplayName("闭括号之后的内容被忽略")
    void testTrailingIgnored() {
        assertThat(DirectiveArguments.splitCallArguments(argsOf("#(m(1) extra)"), diagnostics, 1))
                .containsExactly("1");
    }

    @Test
    @DisplayName("缺少开括号或闭括号时报告诊断")
    void testMalformed() {
        assertThat(DirectiveArguments.splitCallArguments(argsOf("#(m x)"), diagnostics, 3)).isEmpty();
        assertThat(DirectiveArguments.splitCallArguments(argsOf("#(m(1, 2"), diagnostics, 4))
                .containsExactly("1", " 2");

        assertThat(diagnostics.getEntries()).extracting(Diagnostic::kind, Diagnostic::line).containsExactly(
                tuple(DiagnosticKind.EXPECTED_OPEN_PAREN, 3),
                tuple(DiagnosticKind.EXPECTED_CLOSE_PAREN, 4));
    }
}
