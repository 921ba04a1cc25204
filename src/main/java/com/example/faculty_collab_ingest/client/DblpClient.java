package com.example.faculty_collab_ingest.client;

import com.example.faculty_collab_ingest.exception.DblpClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * DBLP 书目下载客户端。
 * 429、5xx（包括不在 HttpStatus 枚举里的状态码）和网络错误按 retryBackoff * 次数 线性退避重试，
 * 其它状态码和客户端异常一律包装为 {@link DblpClientException}。
 */
@Slf4j
@Component
public class DblpClient {

    @Autowired
    private RestTemplate restTemplate;

    @Value("${ingest.dblp.base-url:https://dblp.org}")
    private String baseUrl;

    @Value("${ingest.dblp.max-retries:3}")
    private int maxRetries;

    @Value("${ingest.dblp.retry-backoff-ms:5000}")
    private long retryBackoffMs;

    /**
     * 下载某个 PID 的 .bib 全文
     */
    public String fetchBibliography(String pid) {
        URI uri = bibliographyUri(pid);
        RuntimeException last = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                sleep(retryBackoffMs * attempt, pid);
            }
            try {
                // 响应体统一按 UTF-8 解码
                byte[] body = restTemplate.getForObject(uri, byte[].class);
                return body == null ? "" : new String(body, StandardCharsets.UTF_8);
            } catch (RestClientResponseException e) {
                if (!isRetryable(e.getRawStatusCode())) {
                    throw new DblpClientException(pid, "DBLP returned " + e.getRawStatusCode() + " for " + pid, e);
                }
                log.warn("请求 DBLP {} 返回 {}，第 {} 次尝试", pid, e.getRawStatusCode(), attempt + 1);
                last = e;
            } catch (ResourceAccessException e) {
                log.warn("请求 DBLP {} 网络错误: {}，第 {} 次尝试", pid, e.getMessage(), attempt + 1);
                last = e;
            } catch (RestClientException e) {
                throw new DblpClientException(pid, "Request for " + pid + " failed: " + e.getMessage(), e);
            }
        }
        throw new DblpClientException(pid, "Giving up on " + pid + " after " + (maxRetries + 1) + " attempts", last);
    }

    /**
     * PID 中的 / 是路径分隔符，不能作为模板变量编码成 %2F
     */
    public URI bibliographyUri(String pid) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/pid/" + pid + ".bib")
                .build()
                .toUri();
    }

    private static boolean isRetryable(int status) {
        return status == HttpStatus.TOO_MANY_REQUESTS.value() || status >= 500;
    }

    private static void sleep(long millis, String pid) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DblpClientException(pid, "Interrupted while waiting to retry " + pid, e);
        }
    }
}
