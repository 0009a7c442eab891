package com.lanka.tourbot.util;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 字元 bigram 重疊度計算
 * 用於判斷檢索命中是否真的與查詢相關（避免 n-gram 檢索回傳弱相關結果）
 */
public final class TextOverlap {

    private TextOverlap() {
    }

    /**
     * 正規化：轉小寫並移除空白與標點
     */
    public static String normalize(String s) {
        if (s == null) {
            return "";
        }
        String lower = s.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            int type = Character.getType(c);
            boolean punct = type == Character.CONNECTOR_PUNCTUATION
                    || type == Character.DASH_PUNCTUATION
                    || type == Character.START_PUNCTUATION
                    || type == Character.END_PUNCTUATION
                    || type == Character.INITIAL_QUOTE_PUNCTUATION
                    || type == Character.FINAL_QUOTE_PUNCTUATION
                    || type == Character.OTHER_PUNCTUATION
                    || type == Character.MATH_SYMBOL
                    || type == Character.CURRENCY_SYMBOL
                    || type == Character.MODIFIER_SYMBOL
                    || type == Character.OTHER_SYMBOL;
            if (!punct) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * 字元 bigram Jaccard 相似度
     */
    public static double jaccardCharBigrams(String a, String b) {
        Set<String> sa = bigrams(a);
        Set<String> sb = bigrams(b);
        if (sa.isEmpty() || sb.isEmpty()) {
            return 0.0;
        }

        Set<String> small = sa.size() <= sb.size() ? sa : sb;
        Set<String> large = small == sa ? sb : sa;
        int intersect = 0;
        for (String x : small) {
            if (large.contains(x)) {
                intersect++;
            }
        }

        int union = sa.size() + sb.size() - intersect;
        return union <= 0 ? 0.0 : (double) intersect / (double) union;
    }

    /**
     * 查詢 bigram 被文件覆蓋的比例（適用短查詢）
     */
    public static double queryBigramCoverage(String query, String doc) {
        Set<String> q = bigrams(query);
        if (q.isEmpty()) {
            return 0.0;
        }
        Set<String> d = bigrams(doc);
        int covered = 0;
        for (String x : q) {
            if (d.contains(x)) {
                covered++;
            }
        }
        return (double) covered / (double) q.size();
    }

    private static Set<String> bigrams(String s) {
        Set<String> out = new HashSet<>();
        if (s == null || s.length() < 2) {
            return out;
        }
        for (int i = 0; i + 1 < s.length(); i++) {
            out.add(s.substring(i, i + 2));
        }
        return out;
    }
}
