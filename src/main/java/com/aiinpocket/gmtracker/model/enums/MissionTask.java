package com.aiinpocket.gmtracker.model.enums;

import com.aiinpocket.gmtracker.model.dto.MissionDay;
import lombok.Getter;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 任務 ID → 子任務狀態轉移的對照表。
 *
 * <p>每個 taskId 只對應一個區塊裡的一個子任務。轉移函式只修改 {@link MissionDay}，
 * 不碰儲存層，讓重試迴圈可以在每次重讀後重新套用。
 * 布林子任務第一次出現即成立，與 count 無關；計數子任務累加 count。
 */
@Getter
public enum MissionTask {

    S1_BUY5_ELEMENTS("s1_buy5_elements", MissionSection.S1, (day, count) -> day.getS1().recordElementPurchases(count)),
    S1_BUY_SHIELD("s1_buy_shield", MissionSection.S1, (day, count) -> day.getS1().setBuyShield(true)),
    S1_CLAIM_PRODUCTION("s1_claim_production", MissionSection.S1, (day, count) -> day.getS1().setClaimProduction(true)),
    S2_APPLY_RESOURCES("s2_apply_resources", MissionSection.S2, (day, count) -> day.getS2().setApplyResources(true)),
    S2_ATTACK_PLANT("s2_attack_plant", MissionSection.S2, (day, count) -> day.getS2().setAttackPlant(true)),
    S2_CHAT_MESSAGE("s2_chat_message", MissionSection.S2, (day, count) -> day.getS2().setChatMessage(true)),
    S3_SEND_QUEST("s3_send_quest", MissionSection.S3, (day, count) -> day.getS3().setSendQuest(true)),
    S3_PLACE_ORDER("s3_place_order", MissionSection.S3, (day, count) -> day.getS3().setPlaceOrder(true)),
    S3_CLAIM_STAKE("s3_claim_stake", MissionSection.S3, (day, count) -> day.getS3().setClaimStake(true)),
    S4_MAKE_SWAP("s4_make_swap", MissionSection.S4, (day, count) -> day.getS4().setMakeSwap(true)),
    S4_COLLECT_STAR("s4_collect_star", MissionSection.S4, (day, count) -> day.getS4().setCollectStar(true)),
    S4_PLAY_ARCADE("s4_play_arcade", MissionSection.S4, (day, count) -> day.getS4().setPlayArcade(true));

    private static final Map<String, MissionTask> BY_ID = Arrays.stream(values())
            .collect(Collectors.toMap(MissionTask::getId, Function.identity()));

    private final String id;
    private final MissionSection section;
    private final Transition transition;

    MissionTask(String id, MissionSection section, Transition transition) {
        this.id = id;
        this.section = section;
        this.transition = transition;
    }

    public void apply(MissionDay day, int count) {
        transition.apply(day, count);
    }

    /**
     * @throws IllegalArgumentException 未知的 taskId
     */
    public static MissionTask fromId(String id) {
        MissionTask task = id == null ? null : BY_ID.get(id);
        if (task == null) {
            throw new IllegalArgumentException("Invalid taskId: " + id);
        }
        return task;
    }

    @FunctionalInterface
    interface Transition {
        void apply(MissionDay day, int count);
    }
}
