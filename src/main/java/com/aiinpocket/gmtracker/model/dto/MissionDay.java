package com.aiinpocket.gmtracker.model.dto;

import com.aiinpocket.gmtracker.model.enums.MissionSection;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 單一地址單日的任務紀錄。
 *
 * <p>四個區塊 s1~s4 各有固定配分（20/20/10/30），總分上限 80。
 * 區塊的 done 只會由 false 變 true 一次；pts 在同一天內只增不減；
 * completedAt 在 pts 第一次達到 80 時寫入，之後不再變動。
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MissionDay {

    public static final int MAX_POINTS = 80;

    private String date;
    private ShopSection s1 = new ShopSection();
    private SocialSection s2 = new SocialSection();
    private QuestSection s3 = new QuestSection();
    private TradeSection s4 = new TradeSection();
    private int pts;
    private Long completedAt;

    public static MissionDay initial(String date) {
        MissionDay day = new MissionDay();
        day.setDate(date);
        return day;
    }

    /**
     * 重新評估每個區塊，新完成的區塊加上配分。
     *
     * @param nowMillis 若本次達到滿分，用於 completedAt 的時間戳
     * @return 本次增加的分數
     */
    public int awardCompletedSections(long nowMillis) {
        int award = 0;
        for (MissionSection section : MissionSection.values()) {
            SectionProgress progress = section.of(this);
            if (!progress.isDone() && progress.subtasksComplete()) {
                progress.setDone(true);
                award += section.getWeight();
            }
        }
        int before = pts;
        pts = Math.min(MAX_POINTS, pts + award);
        if (pts == MAX_POINTS && completedAt == null) {
            completedAt = nowMillis;
        }
        return pts - before;
    }

    /** 依 done 旗標重算的分數（上限 80） */
    public int pointsFromDoneSections() {
        int sum = 0;
        for (MissionSection section : MissionSection.values()) {
            if (section.of(this).isDone()) sum += section.getWeight();
        }
        return Math.min(MAX_POINTS, sum);
    }

    /** s1：購買元素 5 次、購買護盾、領取產出 */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ShopSection implements SectionProgress {

        public static final int BUY_ELEMENTS_TARGET = 5;

        private boolean buy5;
        private int buyElementsCount;
        private boolean buyShield;
        private boolean claimProduction;
        private boolean done;

        public void recordElementPurchases(int count) {
            long next = (long) Math.max(0, buyElementsCount) + Math.max(0, count);
            buyElementsCount = (int) Math.min(Integer.MAX_VALUE, next);
            if (buyElementsCount >= BUY_ELEMENTS_TARGET) {
                buy5 = true;
            }
        }

        @Override
        public boolean subtasksComplete() {
            return buy5 && buyShield && claimProduction;
        }
    }

    /** s2：施放資源、攻擊植物、聊天訊息 */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SocialSection implements SectionProgress {
        private boolean applyResources;
        private boolean attackPlant;
        private boolean chatMessage;
        private boolean done;

        @Override
        public boolean subtasksComplete() {
            return applyResources && attackPlant && chatMessage;
        }
    }

    /** s3：送出任務、下單、領取質押 */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QuestSection implements SectionProgress {
        private boolean sendQuest;
        private boolean placeOrder;
        private boolean claimStake;
        private boolean done;

        @Override
        public boolean subtasksComplete() {
            return sendQuest && placeOrder && claimStake;
        }
    }

    /** s4：兌換、收集星星、遊玩街機 */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TradeSection implements SectionProgress {
        private boolean makeSwap;
        private boolean collectStar;
        private boolean playArcade;
        private boolean done;

        @Override
        public boolean subtasksComplete() {
            return makeSwap && collectStar && playArcade;
        }
    }
}
