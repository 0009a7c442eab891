package com.lanka.tourbot.nlp;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 關鍵字比對器
 * <ul>
 *   <li>{@link #of(String)}：拉丁字母詞以字詞邊界比對，允許複數字尾（"hi" 不會命中 "this"，"hotel" 會命中 "hotels"）；
 *       僧伽羅文、泰米爾文等其他文字以子字串比對。用於上下文規則與後備關鍵字這類短詞。</li>
 *   <li>{@link #substring(String)}：一律以子字串比對，用於關鍵字偵測器的命中計數。</li>
 * </ul>
 * 輸入文字應已轉為小寫。
 */
public final class TermMatcher {

    private static final Pattern LATIN_TERM = Pattern.compile("[\\p{IsLatin}\\p{N}\\p{Punct}\\s]+");

    private final String term;
    private final Pattern boundaryPattern;

    private TermMatcher(String term, Pattern boundaryPattern) {
        this.term = term;
        this.boundaryPattern = boundaryPattern;
    }

    public static TermMatcher of(String term) {
        String normalized = term == null ? "" : term.trim().toLowerCase(Locale.ROOT);
        if (!normalized.isEmpty() && LATIN_TERM.matcher(normalized).matches()) {
            Pattern p = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(normalized)
                    + "(?:s|es)?(?![\\p{L}\\p{N}])");
            return new TermMatcher(normalized, p);
        }
        return new TermMatcher(normalized, null);
    }

    public static TermMatcher substring(String term) {
        String normalized = term == null ? "" : term.trim().toLowerCase(Locale.ROOT);
        return new TermMatcher(normalized, null);
    }

    public boolean matches(String loweredText) {
        if (term.isEmpty() || loweredText == null) {
            return false;
        }
        if (boundaryPattern != null) {
            return boundaryPattern.matcher(loweredText).find();
        }
        return loweredText.contains(term);
    }

    public String getTerm() {
        return term;
    }

    @Override
    public String toString() {
        return term;
    }
}
