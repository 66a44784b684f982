package fk.treestats.aggregation.ranking;

public class RankItem<T> {

    private final Rankable<T> item;

    public RankItem(Rankable<T> item) {
        this.item = item;
    }

    public Rankable<T> getItem() {
        return item;
    }

    public T getValue() {
        return item.getValue();
    }

    public int getRankingValue() {
        return item.getRankingValue();
    }

    @Override
    public String toString() {
        return item.getRankingValue() + ": " + item.getValue();
    }
}
