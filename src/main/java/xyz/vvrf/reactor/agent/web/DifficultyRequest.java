package xyz.vvrf.reactor.agent.web;

import lombok.Data;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotNull;

@Data
public class DifficultyRequest {

    /**
     * 表现得分，取值 [0, 1]。
     */
    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double score;
}
