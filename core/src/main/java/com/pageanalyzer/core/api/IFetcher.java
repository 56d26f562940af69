package com.pageanalyzer.core.api;

import com.pageanalyzer.core.exception.FetchException;
import com.pageanalyzer.core.model.FetchResponse;

import java.net.URI;
import java.time.Duration;

/**
 * fetch 최소 계약: URL 을 받아 상태/헤더/본문/소요시간을 돌려준다.
 * 재시도, robots.txt 처리는 구현체(외부 협력자) 책임.
 * HTTP 4xx/5xx 는 예외가 아니라 응답으로 돌려준다.
 */
@FunctionalInterface
public interface IFetcher {
    FetchResponse fetch(URI url, Duration timeout) throws FetchException;
}
