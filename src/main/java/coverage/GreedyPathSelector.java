package coverage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/**
 * Greedy set cover over candidate paths.
 * <p>
 * Repeatedly picks the candidate that covers the most still uncovered elements (the first one
 * on ties), until the universe is covered or no candidate adds anything. The result is not
 * guaranteed to be of minimum size.
 *
 * @param <T> type of the coverage universe elements
 */
public class GreedyPathSelector<T> {
    private static final Logger logger = LoggerFactory.getLogger(GreedyPathSelector.class);

    private final Function<FlowPath, ? extends Collection<T>> coveredBy;

    /**
     * @param coveredBy the universe elements a path covers
     */
    public GreedyPathSelector(Function<FlowPath, ? extends Collection<T>> coveredBy) {
        this.coveredBy = coveredBy;
    }

    public Selection<T> select(Collection<T> universe, List<FlowPath> candidates) {
        Set<T> uncovered = new LinkedHashSet<>(universe);
        List<FlowPath> remaining = new ArrayList<>(candidates);
        List<FlowPath> selected = new ArrayList<>();

        while (!uncovered.isEmpty()) {
            int bestIndex = -1;
            int bestGain = 0;
            for (int i = 0; i < remaining.size(); i++) {
                int gain = gain(remaining.get(i), uncovered);
                if (gain > bestGain) {
                    bestGain = gain;
                    bestIndex = i;
                }
            }
            if (bestIndex < 0) {
                break;
            }
            FlowPath best = remaining.remove(bestIndex);
            selected.add(best);
            uncovered.removeAll(coveredBy.apply(best));
            logger.debug("Selected path {} covering {} new elements, {} left", best, bestGain, uncovered.size());
        }

        if (!uncovered.isEmpty()) {
            logger.warn("No candidate path covers the remaining {} elements: {}", uncovered.size(), uncovered);
        }
        return new Selection<>(selected, uncovered);
    }

    private int gain(FlowPath path, Set<T> uncovered) {
        int gain = 0;
        for (T element : new LinkedHashSet<>(coveredBy.apply(path))) {
            if (uncovered.contains(element)) {
                gain++;
            }
        }
        return gain;
    }
}
