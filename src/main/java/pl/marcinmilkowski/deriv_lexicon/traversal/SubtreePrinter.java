package pl.marcinmilkowski.deriv_lexicon.traversal;

import pl.marcinmilkowski.deriv_lexicon.codec.LexemeRecordCodec;
import pl.marcinmilkowski.deriv_lexicon.forest.DerivationForest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Renders a subtree as indented lines, depth-first and pre-order.
 *
 * Example (unicode style):
 * <pre>
 * 0	do	base	V
 *   ├─1	doer	agent	N	0
 *   │ └─3	doers	plural	N	1
 *   └─2	doing	gerund	N	0
 * </pre>
 */
public final class SubtreePrinter {

    private final RenderStyle style;

    public SubtreePrinter() {
        this(RenderStyle.UNICODE);
    }

    public SubtreePrinter(RenderStyle style) {
        this.style = style;
    }

    public List<String> render(DerivationForest forest, int id) {
        return render(Subtree.of(forest, id));
    }

    public List<String> render(Subtree subtree) {
        List<String> lines = new ArrayList<>();
        lines.add(LexemeRecordCodec.encode(subtree.lexeme()));
        Deque<Line> pending = new ArrayDeque<>();
        pushChildren(subtree, style.blank(), pending);
        while (!pending.isEmpty()) {
            Line line = pending.pop();
            lines.add(line.prefix + (line.last ? style.lastBranch() : style.branch())
                + LexemeRecordCodec.encode(line.node.lexeme()));
            pushChildren(line.node, line.prefix + (line.last ? style.blank() : style.rail()), pending);
        }
        return lines;
    }

    // pushed in reverse so the first child is popped first
    private static void pushChildren(Subtree node, String prefix, Deque<Line> pending) {
        List<Subtree> children = node.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(new Line(children.get(i), prefix, i == children.size() - 1));
        }
    }

    private static final class Line {
        final Subtree node;
        final String prefix;
        final boolean last;

        Line(Subtree node, String prefix, boolean last) {
            this.node = node;
            this.prefix = prefix;
            this.last = last;
        }
    }
}
