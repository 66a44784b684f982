package fk.treestats.aggregation.ranking;

import com.google.common.collect.Ordering;
import fk.treestats.aggregation.DescendantTreeCount;
import fk.treestats.aggregation.StatsConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;

/**
 * Top N rankings, highest ranking value first. Items with equal values keep their input order. The input list is
 * never reordered.
 */
public class Ranker {

    private Ranker() {
    }

    /**
     * @param topN maximum number of items returned, 0 or less for all of them
     */
    public static <T> List<RankItem<T>> rankByValue(List<? extends Rankable<T>> items, int topN) {
        Ordering<Rankable<T>> byValueDesc = Ordering.<Integer>natural()
            .onResultOf((Rankable<T> item) -> item.getRankingValue())
            .reverse();
        List<Rankable<T>> sorted = new ArrayList<>(items);
        sorted.sort(byValueDesc);

        int limit = sorted.size();
        if(topN > 0 && topN < limit) {
            limit = topN;
        }
        return sorted.subList(0, limit).stream().map(RankItem<T>::new).collect(Collectors.toList());
    }

    /**
     * Ranks statistics nodes by the number of direct children they retained.
     */
    public static <V> List<RankItem<V>> rankByChildrenCount(List<DescendantTreeCount<V>> nodes, int topN) {
        return rankByValue(rankables(nodes, DescendantTreeCount::getChildrenCount), topN);
    }

    /**
     * Ranks statistics nodes by the size of their subtree.
     */
    public static <V> List<RankItem<V>> rankByCount(List<DescendantTreeCount<V>> nodes, int topN) {
        return rankByValue(rankables(nodes, DescendantTreeCount::getCount), topN);
    }

    /**
     * {@link #rankByChildrenCount(List, int)} limited to the configured top N.
     */
    public static <V> List<RankItem<V>> rankByChildrenCount(List<DescendantTreeCount<V>> nodes, StatsConfig config) {
        return rankByChildrenCount(nodes, config.getRankingTopN());
    }

    /**
     * {@link #rankByCount(List, int)} limited to the configured top N.
     */
    public static <V> List<RankItem<V>> rankByCount(List<DescendantTreeCount<V>> nodes, StatsConfig config) {
        return rankByCount(nodes, config.getRankingTopN());
    }

    private static <V> List<Rankable<V>> rankables(List<DescendantTreeCount<V>> nodes,
                                                   ToIntFunction<DescendantTreeCount<V>> rankingValue) {
        return nodes.stream()
            .<Rankable<V>>map(node -> new DescendantRankable<>(node, rankingValue))
            .collect(Collectors.toList());
    }

    static class DescendantRankable<V> implements Rankable<V> {

        private final DescendantTreeCount<V> node;
        private final ToIntFunction<DescendantTreeCount<V>> rankingValue;

        DescendantRankable(DescendantTreeCount<V> node, ToIntFunction<DescendantTreeCount<V>> rankingValue) {
            this.node = node;
            this.rankingValue = rankingValue;
        }

        @Override
        public V getValue() {
            return node.getValue();
        }

        @Override
        public int getRankingValue() {
            return rankingValue.applyAsInt(node);
        }
    }
}
