package com.example.faculty_collab_ingest.exception;

/**
 * 访问 DBLP 失败（重试耗尽或返回不可重试的错误码）
 */
public class DblpClientException extends RuntimeException {

    private final String pid;

    public DblpClientException(String pid, String message) {
        super(message);
        this.pid = pid;
    }

    public DblpClientException(String pid, String message, Throwable cause) {
        super(message, cause);
        this.pid = pid;
    }

    public String getPid() {
        return pid;
    }
}
