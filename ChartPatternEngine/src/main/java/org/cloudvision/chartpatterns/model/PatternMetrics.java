package org.cloudvision.chartpatterns.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;

/**
 * Trading metrics of a detected pattern. Each pattern family contributes its
 * own subtype; the common levels live here.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "family"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = HeadAndShouldersMetrics.class, name = "headAndShoulders"),
    @JsonSubTypes.Type(value = TriangleMetrics.class, name = "triangle"),
    @JsonSubTypes.Type(value = DoublePatternMetrics.class, name = "doublePattern")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class PatternMetrics {
    private final int formationPeriod;          // Bars from first to last pattern vertex, inclusive
    private final BigDecimal breakoutLevel;
    private final BigDecimal targetLevel;       // null when the direction is unknown
    private final BigDecimal stopLoss;          // null when the family defines none
    private final Double symmetry;              // 1.0 = perfectly symmetric

    protected PatternMetrics(int formationPeriod, BigDecimal breakoutLevel, BigDecimal targetLevel,
                             BigDecimal stopLoss, Double symmetry) {
        this.formationPeriod = formationPeriod;
        this.breakoutLevel = breakoutLevel;
        this.targetLevel = targetLevel;
        this.stopLoss = stopLoss;
        this.symmetry = symmetry;
    }

    @JsonProperty("formation_period")
    public int getFormationPeriod() { return formationPeriod; }

    @JsonProperty("breakout_level")
    public BigDecimal getBreakoutLevel() { return breakoutLevel; }

    @JsonProperty("target_level")
    public BigDecimal getTargetLevel() { return targetLevel; }

    @JsonProperty("stop_loss")
    public BigDecimal getStopLoss() { return stopLoss; }

    @JsonProperty("symmetry")
    public Double getSymmetry() { return symmetry; }
}
