package com.musicinsights.sparkifywarehouse.application.common.error;

/**
 * 레코드의 필수 필드가 없거나 파싱할 수 없을 때 발생하는 예외.
 *
 * <p>skip 정책이면 해당 레코드만 건너뛰고, abort 정책이면 실행 전체를 롤백한다.</p>
 */
public class MalformedRecordException extends RuntimeException {
    private final String field;

    public MalformedRecordException(String field, String message) {
        super(message);
        this.field = field;
    }

    public MalformedRecordException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * 문제가 된 필드명을 반환한다. JSON 자체를 읽지 못한 경우 null.
     *
     * @return 필드명 또는 null
     */
    public String field() {
        return field;
    }
}
