package com.chih.JXcb.core.analyzer;

import com.chih.JXcb.core.domain.DiagnosticKind;
import com.chih.JXcb.core.engine.Diagnostics;
import com.chih.JXcb.core.parser.BlockDirective;
import com.chih.JXcb.core.parser.Directive;
import com.chih.JXcb.core.parser.Item;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 块结构分析器
 * <p>
 * 把扁平条目序列中的 if / for / macro 与对应的 {@code #(end name)} 配对，折叠为
 * {@link BlockDirective}。嵌套块 (包括同名块) 在每一层尝试匹配 end 之前先递归处理；
 * 作为结束符的 end 指令被消费，不会出现在结果中。
 * </p>
 * <p>
 * 找不到 end 的块会吞掉剩余的全部条目，是否报告由 reportUnterminated 决定。
 * </p>
 *
 * @since 2026/10/19
 */
public class Analyzer {

    public static final Set<String> BLOCK_NAMES = Set.of("if", "for", "macro");

    private final List<Item> items;

    private final Diagnostics diagnostics;

    private final boolean reportUnterminated;

    private int pos;

    public Analyzer(List<Item> items, Diagnostics diagnostics, boolean reportUnterminated) {
        this.items = items;
        this.diagnostics = diagnostics;
        this.reportUnterminated = reportUnterminated;
    }

    public List<Item> analyze() {
        List<Item> output = new ArrayList<>();

        while (pos < items.size()) {
            Item item = items.get(pos++);
            output.add(item instanceof Directive directive ? analyzeDirective(directive) : item);
        }

        return output;
    }

    private Item analyzeDirective(Directive opening) {
        String blockName = opening.name();
        if (!BLOCK_NAMES.contains(blockName)) {
            return opening;
        }

        List<Item> body = new ArrayList<>();
        boolean terminated = false;

        while (pos < items.size()) {
            Item item = items.get(pos++);

            if (item instanceof Directive directive) {
                if (directive.closes(blockName)) {
                    terminated = true;
                    break;
                }
                body.add(analyzeDirective(directive));
            } else {
                body.add(item);
            }
        }

        if (!terminated && reportUnterminated) {
            diagnostics.report(DiagnosticKind.UNTERMINATED_BLOCK, opening.line(),
                    "missing '#(end " + blockName + ")'");
        }

        return new BlockDirective(opening, body);
    }
}
