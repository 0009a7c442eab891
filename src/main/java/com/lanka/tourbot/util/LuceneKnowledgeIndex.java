package com.lanka.tourbot.util;

import com.lanka.tourbot.model.KnowledgeEntry;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.ngram.NGramTokenizer;
import org.apache.lucene.analysis.pattern.PatternReplaceCharFilter;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.queryparser.classic.MultiFieldQueryParser;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 知識庫 Lucene 記憶體索引
 * <p>
 * 以字元 n-gram（1~3）切詞，可同時處理拉丁字母、僧伽羅文與坦米爾文。
 * 每個語言建立獨立索引。
 */
public class LuceneKnowledgeIndex {

    private static final Logger logger = LoggerFactory.getLogger(LuceneKnowledgeIndex.class);

    public record Hit(int entryIndex, float score) {
    }

    private static final String FIELD_ENTRY_INDEX = "entryIndex";
    private static final String FIELD_TITLE = "title";
    private static final String FIELD_ALIASES = "aliases";
    private static final String FIELD_SUMMARY = "summary";
    private static final String FIELD_ALL = "all";
    private static final String FIELD_CAT = "cat";

    // n-gram 查詢子句數量隨長度成長，超過此長度截斷以避免觸發 BooleanQuery 子句上限
    private static final int MAX_QUERY_CHARS = 64;

    private static final Pattern CLEAN_PATTERN = Pattern.compile("[\\s\\p{Punct}]+");

    private final Analyzer analyzer;
    private Directory directory;
    private IndexSearcher searcher;

    public LuceneKnowledgeIndex() {
        this.analyzer = new Analyzer() {
            @Override
            protected Reader initReader(String fieldName, Reader reader) {
                return new PatternReplaceCharFilter(CLEAN_PATTERN, "", reader);
            }

            @Override
            protected TokenStreamComponents createComponents(String fieldName) {
                Tokenizer tokenizer = new NGramTokenizer(1, 3);
                TokenStream stream = new LowerCaseFilter(tokenizer);
                return new TokenStreamComponents(tokenizer, stream);
            }
        };
    }

    public void build(List<KnowledgeEntry> entries) {
        try {
            this.directory = new ByteBuffersDirectory();
            IndexWriterConfig config = new IndexWriterConfig(analyzer);
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);

            try (IndexWriter writer = new IndexWriter(directory, config)) {
                for (int i = 0; i < entries.size(); i++) {
                    KnowledgeEntry entry = entries.get(i);
                    String aliases = entry.getAliases() == null ? "" : String.join(" ", entry.getAliases());
                    Document doc = new Document();
                    doc.add(new StoredField(FIELD_ENTRY_INDEX, i));
                    doc.add(new TextField(FIELD_TITLE, safe(entry.getTitle()), Field.Store.NO));
                    doc.add(new TextField(FIELD_ALIASES, aliases, Field.Store.NO));
                    doc.add(new TextField(FIELD_SUMMARY, safe(entry.getSummary()), Field.Store.NO));
                    doc.add(new TextField(FIELD_ALL, safe(entry.getTitle()) + " " + aliases + " "
                            + safe(entry.getSummary()) + " " + safe(entry.getLocation()), Field.Store.NO));
                    doc.add(new TextField(FIELD_CAT, safe(entry.getCategory()), Field.Store.NO));
                    writer.addDocument(doc);
                }
                writer.commit();
            }

            DirectoryReader reader = DirectoryReader.open(directory);
            this.searcher = new IndexSearcher(reader);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to build Lucene knowledge index", e);
        }
    }

    public int getDocCount() {
        if (searcher == null) {
            return 0;
        }
        return searcher.getIndexReader().numDocs();
    }

    public List<Hit> search(String queryText, int topK) {
        if (searcher == null || queryText == null || queryText.trim().isEmpty() || topK <= 0) {
            return List.of();
        }

        String qText = queryText.trim();
        if (qText.length() > MAX_QUERY_CHARS) {
            qText = qText.substring(0, MAX_QUERY_CHARS);
        }
        boolean shortQuery = qText.length() <= 10;

        Map<String, Float> boosts = new HashMap<>();
        boosts.put(FIELD_TITLE, 2.5f);
        boosts.put(FIELD_ALIASES, 2.0f);
        boosts.put(FIELD_ALL, 1.0f);
        boosts.put(FIELD_SUMMARY, 0.6f);

        String[] fields;
        if (shortQuery) {
            boosts.put(FIELD_CAT, 1.2f);
            fields = new String[]{FIELD_TITLE, FIELD_ALIASES, FIELD_ALL, FIELD_SUMMARY, FIELD_CAT};
        } else {
            fields = new String[]{FIELD_TITLE, FIELD_ALIASES, FIELD_ALL, FIELD_SUMMARY};
        }

        MultiFieldQueryParser parser = new MultiFieldQueryParser(fields, analyzer, boosts);

        Query query;
        try {
            query = parser.parse(MultiFieldQueryParser.escape(qText));
        } catch (ParseException e) {
            logger.debug("無法解析查詢: {} ({})", qText, e.getMessage());
            return List.of();
        }

        try {
            TopDocs topDocs = searcher.search(query, topK);
            List<Hit> hits = new ArrayList<>(topDocs.scoreDocs.length);
            for (ScoreDoc sd : topDocs.scoreDocs) {
                Document doc = searcher.storedFields().document(sd.doc);
                int entryIndex = doc.getField(FIELD_ENTRY_INDEX).numericValue().intValue();
                hits.add(new Hit(entryIndex, sd.score));
            }
            return hits;
        } catch (IOException e) {
            logger.warn("知識庫檢索失敗: {}", e.getMessage());
            return List.of();
        }
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
