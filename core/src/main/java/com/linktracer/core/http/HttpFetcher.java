package com.linktracer.core.http;

import com.linktracer.core.api.IFetcher;
import com.linktracer.core.model.CrawlConfig;
import com.linktracer.core.model.CrawlStats;
import com.linktracer.core.model.FetchMethod;
import com.linktracer.core.model.FetchResult;
import com.linktracer.core.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.IDN;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * JDK HttpClient 기반 fetcher.
 * 리다이렉트는 클라이언트에 맡기지 않고 직접 따라간다(hop 수 상한, 상대 Location 해석).
 * 어떤 경우에도 예외를 던지지 않고 FetchResult 로 돌려준다.
 */
public class HttpFetcher implements IFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final Duration timeout;
    private final String userAgent;
    private final int maxRedirects;
    private final CrawlStats stats;     // null 허용
    private final HttpClient client;    // 프로덕션 경로
    private final HttpSender sender;    // 테스트 경로(있으면 이걸 사용)

    public HttpFetcher(CrawlConfig config) {
        this(config, null);
    }

    public HttpFetcher(CrawlConfig config, CrawlStats stats) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
        this.maxRedirects = config.getMaxRedirects();
        this.stats = stats;
        this.client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpFetcher(CrawlConfig config, CrawlStats stats, HttpSender testSender) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
        this.maxRedirects = config.getMaxRedirects();
        this.stats = stats;
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchResult fetch(String url, FetchMethod method) {
        Objects.requireNonNull(url, "url");
        final FetchMethod m = (method == null ? FetchMethod.GET : method);
        final long start = System.nanoTime();

        String current = url;
        int lastStatus = 0;
        int requests = 0;
        try {
            for (int hop = 0; ; hop++) {
                HttpResponse<String> resp = send(buildRequest(current, m));
                requests++;
                lastStatus = resp.statusCode();

                String location = resp.headers().firstValue("Location").orElse(null);
                if (isRedirectStatus(lastStatus) && location != null && !location.isBlank()) {
                    if (hop >= maxRedirects) {
                        LOG.debug("Redirect cap ({}) reached for {} at {}", maxRedirects, url, current);
                        return toResult(url, current, resp, m, start);
                    }
                    current = URI.create(toRequestUri(current)).resolve(toRequestUri(location.trim())).toString();
                    continue;
                }
                return toResult(url, current, resp, m, start);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(url, m, lastStatus, "interrupted", elapsedMs(start));
        } catch (Exception e) {
            String msg = describe(e);
            LOG.debug("{} {} failed: {}", m, url, msg);
            return FetchResult.failure(url, m, lastStatus, msg, elapsedMs(start));
        } finally {
            if (stats != null) stats.addRequests(requests);
        }
    }

    private HttpRequest buildRequest(String url, FetchMethod m) {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(toRequestUri(url)))
                .timeout(timeout)
                .header("User-Agent", userAgent);
        if (m == FetchMethod.HEAD) {
            b.method("HEAD", HttpRequest.BodyPublishers.noBody());
        } else {
            b.GET();
        }
        return b.build();
    }

    private HttpResponse<String> send(HttpRequest req) throws Exception {
        return (sender != null)
                ? sender.send(req)
                : client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private static FetchResult toResult(String requested, String finalUrl, HttpResponse<String> resp,
                                        FetchMethod m, long start) {
        HttpHeaders hh = resp.headers();
        return FetchResult.builder()
                .requestedUrl(requested)
                .finalUrl(finalUrl)
                .statusCode(resp.statusCode())
                .headers(hh.map())
                .body(m == FetchMethod.HEAD || resp.body() == null ? "" : resp.body())
                .contentType(hh.firstValue("Content-Type").orElse(""))
                .method(m)
                .responseTimeMs(elapsedMs(start))
                .build();
    }

    /**
     * 저장 키(사람이 읽는 형태) → 요청용 ASCII URI.
     * 호스트는 punycode, 그 밖의 비 ASCII 문자와 공백 등은 UTF-8 퍼센트 인코딩.
     * 이미 있는 %XX 는 그대로 둔다. 상대 참조(Location)도 받는다.
     */
    static String toRequestUri(String url) {
        UrlNormalizer.Parts p = UrlNormalizer.parse(url);
        if (p == null) return escapeIllegal(url);
        return p.scheme() + "://" + asciiAuthority(p.authority()) + escapeIllegal(p.rest());
    }

    private static String asciiAuthority(String authority) {
        int at = authority.lastIndexOf('@');
        String userInfo = at >= 0 ? escapeIllegal(authority.substring(0, at + 1)) : "";
        String hostPort = authority.substring(at + 1);
        if (hostPort.startsWith("[")) return userInfo + hostPort; // IPv6 리터럴
        int colon = hostPort.lastIndexOf(':');
        String host = colon >= 0 ? hostPort.substring(0, colon) : hostPort;
        String port = colon >= 0 ? hostPort.substring(colon) : "";
        return userInfo + IDN.toASCII(host, IDN.ALLOW_UNASSIGNED) + port;
    }

    private static final String URI_CHARS = "-._~:/?#@!$&'()*+,;=";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private static String escapeIllegal(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 16);
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c < 0x80 && (Character.isLetterOrDigit(c) || URI_CHARS.indexOf(c) >= 0)) {
                sb.append(c);
                i++;
            } else if (c == '%' && i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))) {
                sb.append(c);
                i++;
            } else {
                int cp = s.codePointAt(i);
                for (byte b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                    sb.append('%').append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
                }
                i += Character.charCount(cp);
            }
        }
        return sb.toString();
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    static boolean isRedirectStatus(int code) {
        return code == 301 || code == 302 || code == 303 || code == 307 || code == 308;
    }

    private static String describe(Exception e) {
        String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + msg;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
