package com.aiinpocket.gmtracker.service;

/**
 * 儲存層持續不可用，主要寫入無法完成。屬可重試錯誤。
 */
public class GamificationStoreException extends RuntimeException {

    public GamificationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
