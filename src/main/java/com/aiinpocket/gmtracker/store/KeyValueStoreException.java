package com.aiinpocket.gmtracker.store;

/**
 * 儲存層暫時性錯誤（連線中斷、逾時等），呼叫端可以重試。
 */
public class KeyValueStoreException extends RuntimeException {

    public KeyValueStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
