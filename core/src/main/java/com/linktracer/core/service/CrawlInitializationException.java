package com.linktracer.core.service;

/** 크롤을 시작조차 못 하는 치명 오류(저장소 연결 실패, 잘못된 설정 등). CLI 종료 코드 1. */
public class CrawlInitializationException extends RuntimeException {
    public CrawlInitializationException(String message) {
        super(message);
    }

    public CrawlInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
