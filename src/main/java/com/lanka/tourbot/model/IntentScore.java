package com.lanka.tourbot.model;

/**
 * 單一意圖分數（用於候選意圖列表）
 */
public record IntentScore(Intent intent, double score) {
}
