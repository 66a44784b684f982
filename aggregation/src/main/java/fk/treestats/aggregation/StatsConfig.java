package fk.treestats.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;

import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

/**
 * Settings for descendant statistics reports. Loaded by {@link StatsConfigManager}.
 */
public class StatsConfig {

    @NotNull
    @DecimalMin("0.0")
    @JsonProperty("threshold")
    private Double threshold = 0.01;

    @NotNull
    @JsonProperty("sort.children")
    private Boolean sortChildren = true;

    // 0 means no limit
    @NotNull
    @Min(0)
    @JsonProperty("ranking.top.n")
    private Integer rankingTopN = 20;

    public Double getThreshold() {
        return threshold;
    }

    public Boolean isSortChildren() {
        return sortChildren;
    }

    public Integer getRankingTopN() {
        return rankingTopN;
    }
}
