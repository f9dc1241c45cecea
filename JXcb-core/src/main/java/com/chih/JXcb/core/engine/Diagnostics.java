package com.chih.JXcb.core.engine;

import com.chih.JXcb.core.domain.Diagnostic;
import com.chih.JXcb.core.domain.DiagnosticKind;
import com.chih.JXcb.core.domain.ErrorPolicy;
import com.chih.JXcb.core.exception.TemplateSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 诊断收集器
 * <p>
 * 结构性错误统一经过这里：记录 warn 日志、追加到列表，
 * 并按 {@link ErrorPolicy} 决定继续还是抛出 {@link TemplateSyntaxException}。
 * </p>
 *
 * @since 2026/10/19
 */
public class Diagnostics {

    private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

    private final ErrorPolicy policy;

    private final List<Diagnostic> entries = new ArrayList<>();

    public Diagnostics(ErrorPolicy policy) {
        this.policy = policy;
    }

    public void report(DiagnosticKind kind, int line, String message) {
        Diagnostic diagnostic = new Diagnostic(kind, line, message);
        entries.add(diagnostic);
        log.warn("[{}] line {}: {}", kind, line, message);

        if (policy == ErrorPolicy.ABORT) {
            throw new TemplateSyntaxException(diagnostic);
        }
    }

    public List<Diagnostic> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
