package com.chih.JXcb.core.support;

import com.chih.JXcb.core.lexer.Token;
import com.chih.JXcb.core.parser.BlockDirective;
import com.chih.JXcb.core.parser.CodeBlock;
import com.chih.JXcb.core.parser.Directive;
import com.chih.JXcb.core.parser.Interpolation;
import com.chih.JXcb.core.parser.Item;
import com.chih.JXcb.core.parser.ItemVisitor;
import com.chih.JXcb.core.parser.Text;

import java.util.List;

/**
 * 调试用：把分析后的条目树打印为缩进文本
 *
 * <pre>
 * text 'Hello '
 * block if
 *     name user
 * end if
 * directive greet
 * (
 * x
 * )
 * </pre>
 *
 * @since 2026/10/19
 */
public final class TemplateTreePrinter implements ItemVisitor<Void> {

    private static final int INDENT_STEP = 4;

    private final StringBuilder out = new StringBuilder();

    private int indent;

    private TemplateTreePrinter() {
    }

    public static String print(List<Item> items) {
        TemplateTreePrinter printer = new TemplateTreePrinter();
        printer.printAll(items);
        return printer.out.toString();
    }

    private void printAll(List<Item> items) {
        for (Item item : items) {
            item.accept(this);
        }
    }

    private void line(String text) {
        out.append(" ".repeat(indent)).append(text).append('\n');
    }

    @Override
    public Void visitText(Text text) {
        line("text '" + text.value() + "'");
        return null;
    }

    @Override
    public Void visitInterpolation(Interpolation interpolation) {
        line("name " + interpolation.expression());
        return null;
    }

    @Override
    public Void visitCodeBlock(CodeBlock codeBlock) {
        line("code " + codeBlock.body());
        return null;
    }

    @Override
    public Void visitDirective(Directive directive) {
        line("directive " + directive.name());
        for (Token arg : directive.args()) {
            line(arg.text());
        }
        return null;
    }

    @Override
    public Void visitBlockDirective(BlockDirective block) {
        line("block " + block.name());
        indent += INDENT_STEP;
        printAll(block.body());
        indent -= INDENT_STEP;
        line("end " + block.name());
        return null;
    }
}
