package com.memclaw.memory.extract;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Canonical topic name to trigger phrases, in English and Chinese. Triggers are matched
 * as lower-case substrings, so very short ones are avoided. Declaration order is the
 * priority order when more topics match than the cap allows.
 */
public final class TopicTaxonomy {

    private static final TopicTaxonomy DEFAULT = new TopicTaxonomy(defaultEntries());

    private final Map<String, List<String>> entries;

    public TopicTaxonomy(Map<String, List<String>> entries) {
        var copy = new LinkedHashMap<String, List<String>>();
        entries.forEach((topic, triggers) -> copy.put(topic,
                triggers.stream().map(t -> t.toLowerCase(Locale.ROOT)).toList()));
        this.entries = copy;
    }

    public static TopicTaxonomy defaults() {
        return DEFAULT;
    }

    public Map<String, List<String>> entries() {
        return entries;
    }

    /** True if {@code token} is the name or one of the triggers of {@code topic}. */
    public boolean covers(String topic, String token) {
        var triggers = entries.get(topic);
        if (triggers == null) return false;
        var lower = token.toLowerCase(Locale.ROOT);
        return topic.toLowerCase(Locale.ROOT).equals(lower) || triggers.contains(lower);
    }

    private static Map<String, List<String>> defaultEntries() {
        var m = new LinkedHashMap<String, List<String>>();
        // infrastructure
        m.put("Docker", List.of("docker", "container", "dockerfile", "docker-compose", "容器", "镜像"));
        m.put("Kubernetes", List.of("kubernetes", "k8s", "kubectl", "helm chart", "集群"));
        m.put("Cloud", List.of("aws", "gcp", "azure", "cloud run", "s3 bucket", "云服务", "云端"));
        // backend
        m.put("API", List.of("api", "endpoint", "graphql", "grpc", "webhook", "接口"));
        m.put("Database", List.of("database", "sql", "postgres", "mongodb", "redis", "schema migration",
                "数据库", "索引", "表结构"));
        m.put("Python", List.of("python", "pip install", "virtualenv", "venv", "pytest"));
        m.put("Java", List.of("java", "jvm", "jdk", "maven", "gradle", "spring boot"));
        m.put("JavaScript", List.of("javascript", "typescript", "node.js", "nodejs", "npm", "前端"));
        m.put("Performance", List.of("performance", "latency", "throughput", "cache", "optimization",
                "optimisation", "性能", "延迟", "缓存", "优化"));
        // AI
        m.put("LLM", List.of("llm", "language model", "gpt", "claude", "gemini", "deepseek", "ollama",
                "prompt", "大模型", "语言模型", "提示词"));
        m.put("AI", List.of("artificial intelligence", "machine learning", "embedding", "retrieval",
                "neural", "人工智能", "机器学习", "向量"));
        m.put("Memory", List.of("memory", "memories", "knowledge graph", "vector store", "记忆", "知识图谱"));
        // assistant surfaces
        m.put("Chatbot", List.of("telegram", "discord", "chatbot", "slack bot", "机器人", "聊天"));
        m.put("Setup", List.of("setup", "installer", "wizard", "configuration", "config file", "配置", "安装"));
        // engineering practice
        m.put("Architecture", List.of("architecture", "design pattern", "microservice", "monolith", "refactor",
                "架构", "设计模式", "重构"));
        m.put("Testing", List.of("unit test", "tests", "testing", "junit", "mockito", "coverage",
                "测试", "单元测试"));
        m.put("Security", List.of("security", "authentication", "password", "api key", "secret", "encryption",
                "安全", "密码", "加密", "权限"));
        m.put("Observability", List.of("observability", "logging", "tracing", "metrics", "telemetry", "dashboard",
                "日志", "监控", "告警"));
        m.put("Release", List.of("release", "deploy", "ci/cd", "pipeline", "changelog", "发布", "部署", "上线"));
        m.put("Bug", List.of("bug", "error", "exception", "crash", "broken", "stack trace", "regression",
                "报错", "异常", "崩溃", "错误"));
        return m;
    }
}
