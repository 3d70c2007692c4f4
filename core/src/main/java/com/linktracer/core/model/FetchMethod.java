package com.linktracer.core.model;

/** GET = 본문까지 수신, HEAD = 존재 확인(본문 없음) */
public enum FetchMethod { GET, HEAD }
