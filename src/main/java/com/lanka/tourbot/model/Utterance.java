package com.lanka.tourbot.model;

/**
 * 使用者輸入（單輪）
 */
public record Utterance(String text, long receivedAt) {

    public static Utterance of(String text) {
        return new Utterance(text, System.currentTimeMillis());
    }

    public boolean isBlank() {
        return text == null || text.trim().isEmpty();
    }
}
