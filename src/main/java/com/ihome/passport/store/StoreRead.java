package com.ihome.passport.store;

/**
 * 键值存储读取结果：命中、未命中或存储不可用。
 */
public record StoreRead(Status status, String value, Throwable cause) {

    public enum Status {
        PRESENT,
        ABSENT,
        UNAVAILABLE
    }

    private static final StoreRead ABSENT = new StoreRead(Status.ABSENT, null, null);

    public static StoreRead present(String value) {
        return new StoreRead(Status.PRESENT, value, null);
    }

    public static StoreRead absent() {
        return ABSENT;
    }

    public static StoreRead unavailable(Throwable cause) {
        return new StoreRead(Status.UNAVAILABLE, null, cause);
    }

    public static StoreRead ofNullable(String value) {
        return value == null ? absent() : present(value);
    }

    public boolean isPresent() {
        return status == Status.PRESENT;
    }

    public boolean isUnavailable() {
        return status == Status.UNAVAILABLE;
    }
}
