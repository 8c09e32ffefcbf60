package com.aiinpocket.gmtracker.model.dto;

/**
 * 任務區塊的共同行為：子任務全部達成即可標記完成，完成後不可回退。
 */
public interface SectionProgress {

    boolean isDone();

    void setDone(boolean done);

    /** 區塊內所有子任務條件是否皆已成立（邏輯 AND） */
    boolean subtasksComplete();
}
