package com.memclaw.memory.graph;

import com.memclaw.memory.Importance;
import com.memclaw.memory.MemoryStats;
import com.memclaw.memory.extract.Entity;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.WildcardQuery;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;

/**
 * Graph store on a Lucene index. Nodes and edges are both documents with a unique
 * {@code uid} term, and every write is an {@code updateDocument} on that term, which
 * gives merge-or-create semantics for free.
 */
public class LuceneGraphStore implements GraphStore {

    private static final Logger log = LoggerFactory.getLogger(LuceneGraphStore.class);

    static final String UID = "uid";
    static final String KIND = "doc_kind";
    static final String LABEL = "label";
    static final String NAME = "name";
    static final String ENTITY_TYPE = "entity_type";
    static final String MEMORY_ID = "memory_id";
    static final String CONTENT = "content";
    static final String CONTENT_LC = "content_lc";
    static final String CATEGORY = "category";
    static final String IMPORTANCE = "importance";
    static final String CREATED_AT = "created_at";
    static final String REL = "rel";
    static final String FROM = "from";
    static final String TO = "to";
    static final String STRENGTH = "strength";

    private static final String NODE = "node";
    private static final String EDGE = "edge";
    private static final String MEMORY = "Memory";
    private static final String TOPIC = "Topic";
    private static final String ENTITY = "Entity";

    // keeps the keyword term under Lucene's 32766-byte limit for any UTF-8 input
    private static final int MAX_CONTENT_TERM_CHARS = 8000;
    private static final int MAX_CONTAINS_QUERY_CHARS = 200;

    private static final Sort NEWEST_FIRST = new Sort(
            new SortField(CREATED_AT, SortField.Type.LONG, true),
            new SortField(MEMORY_ID, SortField.Type.LONG, true));

    private final FSDirectory directory;
    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    public LuceneGraphStore(Path graphPath) throws IOException {
        Files.createDirectories(graphPath);
        this.directory = FSDirectory.open(graphPath);
        try {
            var config = new IndexWriterConfig(new StandardAnalyzer());
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
            this.writer = new IndexWriter(directory, config);
        } catch (IOException e) {
            directory.close();
            throw e;
        }
        this.searcherManager = new SearcherManager(writer, null);
    }

    // ── writes ───────────────────────────────────────────────────────────────

    @Override
    public void upsertMemory(MemoryNode node) {
        var doc = new Document();
        doc.add(new StringField(UID, memoryUid(node.id()), Field.Store.YES));
        doc.add(new StringField(KIND, NODE, Field.Store.NO));
        doc.add(new StringField(LABEL, MEMORY, Field.Store.YES));
        doc.add(new LongPoint(MEMORY_ID, node.id()));
        doc.add(new StoredField(MEMORY_ID, node.id()));
        doc.add(new NumericDocValuesField(MEMORY_ID, node.id()));
        doc.add(new StoredField(CONTENT, node.content()));
        doc.add(new StringField(CONTENT_LC, truncate(node.content().toLowerCase(Locale.ROOT), MAX_CONTENT_TERM_CHARS),
                Field.Store.NO));
        doc.add(new StringField(CATEGORY, node.category(), Field.Store.YES));
        doc.add(new StringField(IMPORTANCE, node.importance().wireName(), Field.Store.YES));
        long created = node.createdAt().toEpochMilli();
        doc.add(new StoredField(CREATED_AT, created));
        doc.add(new NumericDocValuesField(CREATED_AT, created));
        write(memoryUid(node.id()), doc);
    }

    @Override
    public void linkTopic(long memoryId, String topic) {
        var doc = new Document();
        doc.add(new StringField(UID, topicUid(topic), Field.Store.YES));
        doc.add(new StringField(KIND, NODE, Field.Store.NO));
        doc.add(new StringField(LABEL, TOPIC, Field.Store.YES));
        doc.add(new StringField(NAME, topic, Field.Store.YES));
        write(topicUid(topic), doc);
        writeEdge(Relation.HAS_TOPIC, memoryUid(memoryId), topicUid(topic), 1.0);
    }

    @Override
    public void linkEntity(long memoryId, Entity entity) {
        var doc = new Document();
        doc.add(new StringField(UID, entityUid(entity.name()), Field.Store.YES));
        doc.add(new StringField(KIND, NODE, Field.Store.NO));
        doc.add(new StringField(LABEL, ENTITY, Field.Store.YES));
        doc.add(new StringField(NAME, entity.name(), Field.Store.YES));
        doc.add(new StringField(ENTITY_TYPE, entity.type().name(), Field.Store.YES));
        write(entityUid(entity.name()), doc);
        writeEdge(Relation.MENTIONS, memoryUid(memoryId), entityUid(entity.name()), 1.0);
    }

    @Override
    public void linkMemories(Relation relation, long fromId, long toId, double strength) {
        if (fromId == toId) return;
        writeEdge(relation, memoryUid(fromId), memoryUid(toId), strength);
    }

    private void writeEdge(Relation relation, String from, String to, double strength) {
        var uid = relation.name() + "|" + from + "|" + to;
        var doc = new Document();
        doc.add(new StringField(UID, uid, Field.Store.YES));
        doc.add(new StringField(KIND, EDGE, Field.Store.NO));
        doc.add(new StringField(REL, relation.name(), Field.Store.YES));
        doc.add(new StringField(FROM, from, Field.Store.YES));
        doc.add(new StringField(TO, to, Field.Store.YES));
        doc.add(new StoredField(STRENGTH, strength));
        write(uid, doc);
    }

    private void write(String uid, Document doc) {
        try {
            writer.updateDocument(new Term(UID, uid), doc);
            searcherManager.maybeRefreshBlocking();
        } catch (IOException e) {
            throw new GraphStoreException("Failed to write graph document " + uid, e);
        }
    }

    @Override
    public void commit() {
        try {
            writer.commit();
        } catch (IOException e) {
            throw new GraphStoreException("Failed to commit graph index", e);
        }
    }

    @Override
    public void clear() {
        try {
            writer.deleteAll();
            writer.commit();
            searcherManager.maybeRefreshBlocking();
        } catch (IOException e) {
            throw new GraphStoreException("Failed to clear graph index", e);
        }
    }

    // ── reads ────────────────────────────────────────────────────────────────

    @Override
    public boolean containsMemory(long memoryId) {
        return withSearcher(s -> s.count(new TermQuery(new Term(UID, memoryUid(memoryId)))) > 0);
    }

    @Override
    public Optional<MemoryNode> findMemory(long memoryId) {
        return withSearcher(s -> {
            var hits = s.search(new TermQuery(new Term(UID, memoryUid(memoryId))), 1).scoreDocs;
            if (hits.length == 0) return Optional.empty();
            return Optional.of(toNode(s.storedFields().document(hits[0].doc)));
        });
    }

    @Override
    public Set<Long> memoryIds() {
        return withSearcher(s -> {
            var ids = new TreeSet<Long>();
            for (var hit : searchAll(s, labelQuery(MEMORY))) {
                ids.add(s.storedFields().document(hit.doc).getField(MEMORY_ID).numericValue().longValue());
            }
            return ids;
        });
    }

    @Override
    public OptionalLong previousMemoryId(long memoryId) {
        var query = new BooleanQuery.Builder()
                .add(labelQuery(MEMORY), BooleanClause.Occur.FILTER)
                .add(LongPoint.newRangeQuery(MEMORY_ID, Long.MIN_VALUE, memoryId - 1), BooleanClause.Occur.FILTER)
                .build();
        var byIdDesc = new Sort(new SortField(MEMORY_ID, SortField.Type.LONG, true));
        return withSearcher(s -> {
            var hits = s.search(query, 1, byIdDesc).scoreDocs;
            if (hits.length == 0) return OptionalLong.empty();
            return OptionalLong.of(s.storedFields().document(hits[0].doc)
                    .getField(MEMORY_ID).numericValue().longValue());
        });
    }

    @Override
    public List<Long> memoriesSharingTopics(long memoryId, Collection<String> topics, int limit) {
        var ids = new TreeSet<Long>(Comparator.reverseOrder());
        ids.addAll(sourcesOf(Relation.HAS_TOPIC, topics.stream().map(LuceneGraphStore::topicUid).toList()));
        ids.remove(memoryId);
        return ids.stream().limit(limit).toList();
    }

    @Override
    public Optional<MemoryNode> latestMemoryContaining(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        var needle = text.trim().toLowerCase(Locale.ROOT);
        // longer needles are left to the caller's full-content search
        if (needle.length() > MAX_CONTAINS_QUERY_CHARS) return Optional.empty();
        var query = new BooleanQuery.Builder()
                .add(labelQuery(MEMORY), BooleanClause.Occur.FILTER)
                .add(new WildcardQuery(new Term(CONTENT_LC, "*" + escapeWildcard(needle) + "*")),
                        BooleanClause.Occur.FILTER)
                .build();
        return withSearcher(s -> {
            var hits = s.search(query, 1, NEWEST_FIRST).scoreDocs;
            if (hits.length == 0) return Optional.empty();
            return Optional.of(toNode(s.storedFields().document(hits[0].doc)));
        });
    }

    @Override
    public List<MemoryNode> traverse(long seedId, Set<Relation> relations, int depth) {
        var seed = memoryUid(seedId);
        var visited = new LinkedHashSet<String>();
        visited.add(seed);
        var reached = new LinkedHashSet<Long>();
        var frontier = List.of(seed);

        for (int hop = 0; hop < depth && !frontier.isEmpty(); hop++) {
            var next = new ArrayList<String>();
            for (var uid : frontier) {
                for (var neighbour : neighbours(uid, relations)) {
                    if (visited.add(neighbour)) {
                        next.add(neighbour);
                        reached.add(parseMemoryId(neighbour));
                    }
                }
            }
            frontier = next;
        }
        return loadNewestFirst(reached, Integer.MAX_VALUE);
    }

    @Override
    public List<MemoryNode> memoriesWithTopics(Collection<String> topics, int limit) {
        var ids = sourcesOf(Relation.HAS_TOPIC, topics.stream().map(LuceneGraphStore::topicUid).toList());
        return loadNewestFirst(ids, limit);
    }

    @Override
    public List<MemoryNode> memoriesMentioning(Collection<String> entityNames, int limit) {
        var ids = sourcesOf(Relation.MENTIONS, entityNames.stream().map(LuceneGraphStore::entityUid).toList());
        return loadNewestFirst(ids, limit);
    }

    @Override
    public MemoryStats.GraphStoreStats stats() {
        return withSearcher(s -> new MemoryStats.GraphStoreStats(
                s.count(new TermQuery(new Term(KIND, NODE))),
                s.count(new TermQuery(new Term(KIND, EDGE)))));
    }

    @Override
    public void close() {
        try {
            searcherManager.close();
            writer.close();
            directory.close();
        } catch (IOException e) {
            log.error("Failed to close graph store", e);
        }
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    /** Memory ids on the source side of {@code relation} edges pointing at any of {@code targets}. */
    private Set<Long> sourcesOf(Relation relation, List<String> targets) {
        if (targets.isEmpty()) return Set.of();
        var query = new BooleanQuery.Builder()
                .add(new TermQuery(new Term(KIND, EDGE)), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(REL, relation.name())), BooleanClause.Occur.FILTER)
                .add(anyOf(TO, targets), BooleanClause.Occur.FILTER)
                .build();
        return withSearcher(s -> {
            var ids = new LinkedHashSet<Long>();
            for (var hit : searchAll(s, query)) {
                ids.add(parseMemoryId(s.storedFields().document(hit.doc).get(FROM)));
            }
            return ids;
        });
    }

    private List<String> neighbours(String uid, Set<Relation> relations) {
        if (relations.isEmpty()) return List.of();
        var query = new BooleanQuery.Builder()
                .add(new TermQuery(new Term(KIND, EDGE)), BooleanClause.Occur.FILTER)
                .add(anyOf(REL, relations.stream().map(Relation::name).toList()), BooleanClause.Occur.FILTER)
                .add(new BooleanQuery.Builder()
                        .add(new TermQuery(new Term(FROM, uid)), BooleanClause.Occur.SHOULD)
                        .add(new TermQuery(new Term(TO, uid)), BooleanClause.Occur.SHOULD)
                        .build(), BooleanClause.Occur.FILTER)
                .build();
        return withSearcher(s -> {
            var result = new ArrayList<String>();
            for (var hit : searchAll(s, query)) {
                var edge = s.storedFields().document(hit.doc);
                var from = edge.get(FROM);
                result.add(uid.equals(from) ? edge.get(TO) : from);
            }
            return result;
        });
    }

    private List<MemoryNode> loadNewestFirst(Collection<Long> ids, int limit) {
        var nodes = new ArrayList<MemoryNode>();
        for (var id : ids) findMemory(id).ifPresent(nodes::add);
        nodes.sort(Comparator.comparing(MemoryNode::createdAt).reversed()
                .thenComparing(Comparator.comparingLong(MemoryNode::id).reversed()));
        return nodes.size() > limit ? new ArrayList<>(nodes.subList(0, limit)) : nodes;
    }

    private static Query labelQuery(String label) {
        return new TermQuery(new Term(LABEL, label));
    }

    private static Query anyOf(String field, Collection<String> values) {
        if (values.isEmpty()) return new MatchNoDocsQuery();
        var builder = new BooleanQuery.Builder();
        for (var v : values) builder.add(new TermQuery(new Term(field, v)), BooleanClause.Occur.SHOULD);
        return builder.build();
    }

    private static ScoreDoc[] searchAll(IndexSearcher searcher, Query query) throws IOException {
        int n = Math.max(1, searcher.getIndexReader().maxDoc());
        return searcher.search(query, n).scoreDocs;
    }

    private <T> T withSearcher(SearcherCall<T> call) {
        IndexSearcher searcher = null;
        try {
            searcher = searcherManager.acquire();
            return call.apply(searcher);
        } catch (IOException e) {
            throw new GraphStoreException("Graph query failed", e);
        } finally {
            if (searcher != null) {
                try {
                    searcherManager.release(searcher);
                } catch (IOException e) {
                    log.warn("Failed to release graph searcher: {}", e.getMessage());
                }
            }
        }
    }

    private static MemoryNode toNode(Document doc) {
        return new MemoryNode(
                doc.getField(MEMORY_ID).numericValue().longValue(),
                doc.get(CONTENT),
                doc.get(CATEGORY),
                Importance.parse(doc.get(IMPORTANCE)),
                Instant.ofEpochMilli(doc.getField(CREATED_AT).numericValue().longValue()));
    }

    static String memoryUid(long id) {
        return "memory:" + id;
    }

    static String topicUid(String name) {
        return "topic:" + name;
    }

    static String entityUid(String name) {
        return "entity:" + name;
    }

    private static long parseMemoryId(String uid) {
        return Long.parseLong(uid.substring("memory:".length()));
    }

    static String escapeWildcard(String text) {
        var sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == '*' || c == '?' || c == WildcardQuery.WILDCARD_ESCAPE) sb.append(WildcardQuery.WILDCARD_ESCAPE);
            sb.append(c);
        }
        return sb.toString();
    }

    private static String truncate(String s, int max) {
        if (s.length() <= max) return s;
        // never split a surrogate pair
        int end = Character.isHighSurrogate(s.charAt(max - 1)) ? max - 1 : max;
        return s.substring(0, end);
    }

    @FunctionalInterface
    private interface SearcherCall<T> {
        T apply(IndexSearcher searcher) throws IOException;
    }
}
