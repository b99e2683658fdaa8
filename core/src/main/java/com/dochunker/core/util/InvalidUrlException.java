package com.dochunker.core.util;

/** URL 파싱 실패. 호출자는 해당 URL을 건너뛴다. */
public class InvalidUrlException extends IllegalArgumentException {
    public InvalidUrlException(String url) {
        super("Invalid URL: " + url);
    }

    public InvalidUrlException(String url, Throwable cause) {
        super("Invalid URL: " + url, cause);
    }
}
