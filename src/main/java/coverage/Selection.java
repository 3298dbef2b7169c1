package coverage;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Paths chosen by {@link GreedyPathSelector} and the universe elements none of them covers.
 */
public class Selection<T> {
    private final List<FlowPath> selected;
    private final Set<T> uncovered;

    public Selection(List<FlowPath> selected, Set<T> uncovered) {
        this.selected = List.copyOf(selected);
        this.uncovered = Collections.unmodifiableSet(new LinkedHashSet<>(uncovered));
    }

    public List<FlowPath> getSelected() { return selected; }

    public Set<T> getUncovered() { return uncovered; }

    public boolean isComplete() { return uncovered.isEmpty(); }
}
