package com.lanka.tourbot.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 知識庫條目
 * 景點、美食、交通、文化等旅遊資訊，每筆條目對應單一語言
 */
public class KnowledgeEntry {

    private String id;
    private String category;
    private String key;
    private String language;
    private String title;
    private String summary;

    // 景點專屬欄位
    private String location;
    private String bestTime;
    private String duration;
    private String entryFee;

    private String tips;
    private List<String> aliases = new ArrayList<>();

    // 檢索評分（不屬於原始資料）
    private double score;

    public KnowledgeEntry() {}

    public KnowledgeEntry(String id, String category, String key, String language, String title, String summary) {
        this.id = id;
        this.category = category;
        this.key = key;
        this.language = language;
        this.title = title;
        this.summary = summary;
    }

    // 複製（用於返回結果時不修改原始資料）
    public KnowledgeEntry copy() {
        KnowledgeEntry copy = new KnowledgeEntry(id, category, key, language, title, summary);
        copy.setLocation(location);
        copy.setBestTime(bestTime);
        copy.setDuration(duration);
        copy.setEntryFee(entryFee);
        copy.setTips(tips);
        copy.setAliases(aliases == null ? new ArrayList<>() : new ArrayList<>(aliases));
        copy.setScore(score);
        return copy;
    }

    /**
     * 名稱是否符合 key 或任一別名（不分大小寫）
     */
    public boolean matchesName(String name) {
        if (name == null) {
            return false;
        }
        String n = name.trim();
        if (n.equalsIgnoreCase(key) || n.equalsIgnoreCase(title)) {
            return true;
        }
        if (aliases != null) {
            for (String alias : aliases) {
                if (n.equalsIgnoreCase(alias)) {
                    return true;
                }
            }
        }
        return false;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getBestTime() {
        return bestTime;
    }

    public void setBestTime(String bestTime) {
        this.bestTime = bestTime;
    }

    public String getDuration() {
        return duration;
    }

    public void setDuration(String duration) {
        this.duration = duration;
    }

    public String getEntryFee() {
        return entryFee;
    }

    public void setEntryFee(String entryFee) {
        this.entryFee = entryFee;
    }

    public String getTips() {
        return tips;
    }

    public void setTips(String tips) {
        this.tips = tips;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public void setAliases(List<String> aliases) {
        this.aliases = aliases;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    @Override
    public String toString() {
        return "KnowledgeEntry{id='" + id + "', category='" + category + "', language='" + language
                + "', title='" + title + "', score=" + score + "}";
    }
}
