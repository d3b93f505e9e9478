package com.sassed.extend;

import com.sassed.error.EvalException;
import com.sassed.selector.CompoundSelector;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.api.map.primitive.MutableObjectIntMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.eclipse.collections.impl.factory.primitive.ObjectIntMaps;

import java.util.List;

/**
 * Extend targets indexed by id, each with the extensions pointing at it. An edge runs from
 * target A to target B when some extender of A itself matches B, so a chain of extends is a
 * path and a loop of extends is a cycle.
 */
public class ExtendGraph {
    private final MutableObjectIntMap<CompoundSelector> ids = ObjectIntMaps.mutable.empty();
    private final MutableList<CompoundSelector> targets = Lists.mutable.empty();
    private final MutableList<MutableList<Extension>> extensions = Lists.mutable.empty();

    public void add(Extension extension) {
        int id = ids.getIfAbsent(extension.target(), -1);
        if (id < 0) {
            id = targets.size();
            ids.put(extension.target(), id);
            targets.add(extension.target());
            extensions.add(Lists.mutable.empty());
        }
        MutableList<Extension> existing = extensions.get(id);
        if (!existing.contains(extension)) {
            existing.add(extension);
        }
    }

    public boolean isEmpty() {
        return targets.isEmpty();
    }

    public int size() {
        return targets.size();
    }

    public CompoundSelector target(int id) {
        return targets.get(id);
    }

    public List<Extension> extensionsOf(int id) {
        return extensions.get(id);
    }

    /**
     * Ids of all targets whose simple selectors all appear in {@code compound}.
     */
    public MutableIntList targetsMatching(CompoundSelector compound) {
        MutableIntList matching = IntLists.mutable.empty();
        for (int id = 0; id < targets.size(); id++) {
            if (compound.containsAll(targets.get(id))) {
                matching.add(id);
            }
        }
        return matching;
    }

    private MutableIntList successors(int id) {
        MutableIntList next = IntLists.mutable.empty();
        for (Extension extension : extensions.get(id)) {
            targetsMatching(extension.extender().last()).forEach(target -> {
                if (!next.contains(target)) {
                    next.add(target);
                }
            });
        }
        return next;
    }

    /**
     * Rejects extends that loop back on themselves, directly or through other targets.
     */
    public void checkCycles() {
        int[] state = new int[targets.size()];
        for (int id = 0; id < targets.size(); id++) {
            if (state[id] == 0) {
                visit(id, state);
            }
        }
    }

    // 0 = unvisited, 1 = on the current path, 2 = done
    private void visit(int id, int[] state) {
        state[id] = 1;
        MutableIntList next = successors(id);
        for (int i = 0; i < next.size(); i++) {
            int target = next.get(i);
            if (state[target] == 1) {
                Extension extension = extensions.get(id).detect(e -> e.extender().last().containsAll(targets.get(target)));
                String message = target == id
                        ? "\"" + extension.extender() + "\" cannot extend itself"
                        : "Circular @extend between \"" + targets.get(id) + "\" and \"" + targets.get(target) + "\"";
                throw new EvalException(message, extension.position());
            }
            if (state[target] == 0) {
                visit(target, state);
            }
        }
        state[id] = 2;
    }
}
