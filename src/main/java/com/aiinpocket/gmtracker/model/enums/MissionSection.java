package com.aiinpocket.gmtracker.model.enums;

import com.aiinpocket.gmtracker.model.dto.MissionDay;
import com.aiinpocket.gmtracker.model.dto.SectionProgress;
import lombok.Getter;

import java.util.function.Function;

/**
 * 任務區塊與配分。
 */
@Getter
public enum MissionSection {

    S1("s1", 20, MissionDay::getS1),
    S2("s2", 20, MissionDay::getS2),
    S3("s3", 10, MissionDay::getS3),
    S4("s4", 30, MissionDay::getS4);

    private final String key;
    private final int weight;
    private final Function<MissionDay, SectionProgress> accessor;

    MissionSection(String key, int weight, Function<MissionDay, SectionProgress> accessor) {
        this.key = key;
        this.weight = weight;
        this.accessor = accessor;
    }

    public SectionProgress of(MissionDay day) {
        return accessor.apply(day);
    }
}
