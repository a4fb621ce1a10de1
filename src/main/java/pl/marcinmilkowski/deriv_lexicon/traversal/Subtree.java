package pl.marcinmilkowski.deriv_lexicon.traversal;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.deriv_lexicon.forest.DerivationForest;
import pl.marcinmilkowski.deriv_lexicon.model.ForestIntegrityException;
import pl.marcinmilkowski.deriv_lexicon.model.Lexeme;
import pl.marcinmilkowski.deriv_lexicon.store.ChildList;
import pl.marcinmilkowski.deriv_lexicon.store.LexemeView;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * A lexeme together with the subtrees of its children, in child-list order.
 */
public record Subtree(Lexeme lexeme, List<Subtree> children) {

    public Subtree {
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Collects the subtree rooted at the given id. Does not modify the forest.
     *
     * @throws ForestIntegrityException if a lexeme is reached twice on one path
     * @throws IndexOutOfBoundsException if the id is not in the forest
     */
    public static Subtree of(DerivationForest forest, int id) {
        LexemeView store = forest.store();
        store.get(id);
        boolean[] onPath = new boolean[store.size()];
        Deque<Frame> stack = new ArrayDeque<>();
        onPath[id] = true;
        stack.push(new Frame(id, store.children(id)));
        while (true) {
            Frame top = stack.peek();
            if (top.next < top.childIds.size()) {
                int childId = top.childIds.get(top.next++);
                if (onPath[childId]) {
                    throw ForestIntegrityException.cycle(childId);
                }
                onPath[childId] = true;
                stack.push(new Frame(childId, store.children(childId)));
                continue;
            }
            stack.pop();
            onPath[top.id] = false;
            Subtree done = new Subtree(store.get(top.id), top.collected);
            if (stack.isEmpty()) {
                return done;
            }
            stack.peek().collected.add(done);
        }
    }

    /** One lexeme whose children are still being collected. */
    private static final class Frame {
        final int id;
        final ChildList childIds;
        final List<Subtree> collected;
        int next;

        Frame(int id, ChildList childIds) {
            this.id = id;
            this.childIds = childIds;
            this.collected = new ArrayList<>(childIds.size());
        }
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * @return number of lexemes in this subtree, root included
     */
    public int size() {
        int total = 0;
        Deque<Subtree> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Subtree node = pending.pop();
            total++;
            for (Subtree child : node.children) {
                pending.push(child);
            }
        }
        return total;
    }

    /**
     * @return length of the longest root-to-leaf path, 0 for a leaf
     */
    public int depth() {
        int depth = -1;
        List<Subtree> level = List.of(this);
        while (!level.isEmpty()) {
            depth++;
            List<Subtree> next = new ArrayList<>();
            for (Subtree node : level) {
                next.addAll(node.children);
            }
            level = next;
        }
        return depth;
    }

    public JSONObject toJson() {
        JSONObject root = describe(lexeme);
        Deque<Subtree> pendingNodes = new ArrayDeque<>();
        Deque<JSONObject> pendingObjects = new ArrayDeque<>();
        pendingNodes.push(this);
        pendingObjects.push(root);
        while (!pendingNodes.isEmpty()) {
            Subtree node = pendingNodes.pop();
            JSONObject obj = pendingObjects.pop();
            if (node.children.isEmpty()) {
                continue;
            }
            JSONArray arr = new JSONArray();
            for (Subtree child : node.children) {
                JSONObject childObj = describe(child.lexeme);
                arr.add(childObj);
                pendingNodes.push(child);
                pendingObjects.push(childObj);
            }
            obj.put("children", arr);
        }
        return root;
    }

    private static JSONObject describe(Lexeme lexeme) {
        JSONObject obj = new JSONObject();
        obj.put("id", lexeme.id());
        obj.put("lemma", lexeme.lemma());
        obj.put("derivation_pattern", lexeme.derivationPattern());
        obj.put("pos", lexeme.partOfSpeech());
        if (lexeme.hasParent()) obj.put("parent", lexeme.parentId());
        return obj;
    }
}
