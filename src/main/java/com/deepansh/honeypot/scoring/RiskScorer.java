package com.deepansh.honeypot.scoring;

public interface RiskScorer {

    /** Stateless; never throws. Blank text scores as {@link RiskAssessment#none()}. */
    RiskAssessment score(String text);
}
