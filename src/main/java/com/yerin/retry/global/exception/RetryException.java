package com.yerin.retry.global.exception;

import com.yerin.retry.global.exception.code.ErrorCode;
import lombok.Getter;

@Getter
public class RetryException extends RuntimeException {

    private final ErrorCode errorCode;

    public RetryException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public RetryException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }
}
