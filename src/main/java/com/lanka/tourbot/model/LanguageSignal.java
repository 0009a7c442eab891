package com.lanka.tourbot.model;

/**
 * 語言偵測結果
 */
public record LanguageSignal(Language language, double confidence) {
}
