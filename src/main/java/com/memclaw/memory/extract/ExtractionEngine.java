package com.memclaw.memory.extract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Labels free text with topics and typed entities. Both lists are capped so a single
 * memory never fans out into more than a handful of graph edges.
 */
public class ExtractionEngine {

    public static final int DEFAULT_MAX_TOPICS = 3;
    public static final int DEFAULT_MAX_ENTITIES = 3;

    private static final List<String> KNOWN_TECHNOLOGIES = List.of(
            "PostgreSQL", "MySQL", "SQLite", "MongoDB", "Redis", "Elasticsearch", "Lucene",
            "Kafka", "Docker", "Kubernetes", "Terraform", "Prometheus", "Grafana",
            "Spring Boot", "Jackson", "Netty", "FastAPI", "Django", "Flask",
            "React", "Vue", "Next.js", "Vite", "Python",
            "OpenAI", "Anthropic", "DeepSeek", "Ollama", "LangChain", "LlamaIndex");

    private static final List<Pattern> TECHNOLOGY_PATTERNS = KNOWN_TECHNOLOGIES.stream()
            .map(t -> Pattern.compile("(?<![\\p{L}\\p{N}_])" + Pattern.quote(t) + "(?![\\p{L}\\p{N}_])"))
            .toList();

    // topic and entity names become graph keys; longer tokens are noise, not names
    static final int MAX_NAME_LENGTH = 120;

    // HybridMemory, SyncWorker
    private static final Pattern COMPOUND_WORD = Pattern.compile("\\b[A-Z][a-z]++(?:[A-Z][a-z]++)++\\b");
    // HybridMemoryStore, PostgreSQL, JdbcFastStore2
    private static final Pattern CLASS_NAME = Pattern.compile("\\b[A-Z][a-z0-9]++[A-Z][A-Za-z0-9]*+\\b");
    private static final Pattern PATH_TOKEN = Pattern.compile("[\\w./-]++");
    private static final Set<String> FILE_EXTENSIONS = Set.of(
            "java", "py", "kt", "js", "ts", "yaml", "yml", "md", "sh", "json", "txt", "xml", "properties", "sql", "toml");
    private static final Pattern CONFIG_KEY = Pattern.compile("\\b[A-Z][A-Z0-9_]{3,}+\\b");

    private final TopicTaxonomy taxonomy;
    private final int maxTopics;
    private final int maxEntities;

    public ExtractionEngine() {
        this(TopicTaxonomy.defaults(), DEFAULT_MAX_TOPICS, DEFAULT_MAX_ENTITIES);
    }

    public ExtractionEngine(TopicTaxonomy taxonomy, int maxTopics, int maxEntities) {
        if (maxTopics < 1 || maxEntities < 1) {
            throw new IllegalArgumentException("extraction caps must be positive");
        }
        this.taxonomy = taxonomy;
        this.maxTopics = maxTopics;
        this.maxEntities = maxEntities;
    }

    public List<String> extractTopics(String text) {
        if (text == null || text.isBlank()) return List.of();
        var lower = text.toLowerCase(Locale.ROOT);
        var found = new ArrayList<String>();

        for (var entry : taxonomy.entries().entrySet()) {
            for (var trigger : entry.getValue()) {
                if (lower.contains(trigger)) {
                    found.add(entry.getKey());
                    break;
                }
            }
        }

        var m = COMPOUND_WORD.matcher(text);
        while (m.find()) {
            var token = m.group();
            if (token.length() > MAX_NAME_LENGTH || found.contains(token)) continue;
            boolean covered = found.stream().anyMatch(topic -> taxonomy.covers(topic, token));
            if (!covered) found.add(token);
        }

        return found.size() > maxTopics ? List.copyOf(found.subList(0, maxTopics)) : List.copyOf(found);
    }

    public List<Entity> extractEntities(String text) {
        if (text == null || text.isBlank()) return List.of();
        var byName = new LinkedHashMap<String, Entity>();

        for (int i = 0; i < KNOWN_TECHNOLOGIES.size(); i++) {
            if (TECHNOLOGY_PATTERNS.get(i).matcher(text).find()) {
                var name = KNOWN_TECHNOLOGIES.get(i);
                byName.putIfAbsent(name, new Entity(name, EntityType.TECHNOLOGY));
            }
        }
        collect(CLASS_NAME, text, EntityType.CLASS, byName);
        collectFilePaths(text, byName);
        collect(CONFIG_KEY, text, EntityType.CONFIG, byName);

        var entities = new ArrayList<>(byName.values());
        return entities.size() > maxEntities ? List.copyOf(entities.subList(0, maxEntities)) : List.copyOf(entities);
    }

    public int maxTopics() { return maxTopics; }

    public int maxEntities() { return maxEntities; }

    private static void collect(Pattern pattern, String text, EntityType type, LinkedHashMap<String, Entity> byName) {
        var m = pattern.matcher(text);
        while (m.find()) {
            var name = m.group();
            if (name.length() >= 4 && name.length() <= MAX_NAME_LENGTH) byName.putIfAbsent(name, new Entity(name, type));
        }
    }

    private static void collectFilePaths(String text, LinkedHashMap<String, Entity> byName) {
        var m = PATH_TOKEN.matcher(text);
        while (m.find()) {
            var token = stripTrailing(m.group());
            if (token.length() < 4 || token.length() > MAX_NAME_LENGTH) continue;
            int dot = token.lastIndexOf('.');
            if (dot <= 0 || !FILE_EXTENSIONS.contains(token.substring(dot + 1))) continue;
            byName.putIfAbsent(token, new Entity(token, EntityType.FILE));
        }
    }

    // "see Main.java." ends a sentence, not the path
    private static String stripTrailing(String token) {
        int end = token.length();
        while (end > 0 && ".-/".indexOf(token.charAt(end - 1)) >= 0) end--;
        return token.substring(0, end);
    }
}
