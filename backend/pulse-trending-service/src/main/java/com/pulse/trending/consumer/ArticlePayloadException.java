package com.pulse.trending.consumer;

/**
 * An ingestion payload that cannot be read as an article at all.
 */
public class ArticlePayloadException extends RuntimeException {

    public ArticlePayloadException(String message) {
        super(message);
    }

    public ArticlePayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
