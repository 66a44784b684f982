package fk.treestats.aggregation.ranking;

/**
 * Anything that can be ranked by an int.
 */
public interface Rankable<T> {

    T getValue();

    int getRankingValue();
}
