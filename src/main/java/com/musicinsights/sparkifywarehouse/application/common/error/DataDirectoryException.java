package com.musicinsights.sparkifywarehouse.application.common.error;

import java.nio.file.Path;

/**
 * 입력 데이터 루트 디렉터리를 탐색할 수 없을 때 발생하는 예외.
 *
 * <p>경로가 디렉터리가 아니거나 읽을 수 없는 경우이며, 적재가 시작되기 전에 실행 전체를 중단시킨다.</p>
 */
public class DataDirectoryException extends RuntimeException {
    private final Path root;

    public DataDirectoryException(Path root, String message) {
        super(message + ": " + root);
        this.root = root;
    }

    public DataDirectoryException(Path root, String message, Throwable cause) {
        super(message + ": " + root, cause);
        this.root = root;
    }

    /**
     * 문제가 된 루트 경로를 반환한다.
     *
     * @return 루트 경로
     */
    public Path root() {
        return root;
    }
}
