package com.memclaw.agent;

import com.memclaw.memory.Importance;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Heuristic filter that keeps greetings, acknowledgements and other noise out of
 * long-term memory. Scores a conversation turn between 0 and 1.
 */
public class MemoryRelevanceGate {

    public static final double DEFAULT_THRESHOLD = 0.5;

    private static final List<Pattern> JUNK = List.of(
            Pattern.compile("^(ok|okay|k|thanks|thank you|thx|ty|cool|nice|sure|yes|yep|no|nope|lol)\\W*$"),
            Pattern.compile("^(hi|hello|hey|yo|good morning|good night|bye)\\W*$"),
            Pattern.compile("^(got it|i see|i understand|makes sense|understood|great|perfect)\\W*$"),
            Pattern.compile("^(好的|好|嗯|嗯嗯|谢谢|多谢|你好|收到|明白|了解|哈哈)\\W*$"));

    private static final List<String> CODE_MARKERS = List.of(
            "```", "{", "=>", " = ", "def ", "class ", "import ", ".py", ".java", ".js", "()");

    private static final List<String> KEYWORDS = List.of(
            "error", "bug", "fix", "setup", "config", "deploy", "architecture", "design", "python", "java",
            "database", "postgres", "api", "docker", "graph", "memory", "project", "code", "test", "release",
            "错误", "修复", "配置", "部署", "架构", "数据库", "项目", "代码", "测试");

    private static final List<String> PERSONAL_FACTS = List.of(
            "i prefer", "i like", "i use", "i work", "my ", "we decided", "decided", "we use", "remember",
            "我喜欢", "我们决定", "我在", "我的", "记住");

    private final double threshold;

    public MemoryRelevanceGate() {
        this(DEFAULT_THRESHOLD);
    }

    public MemoryRelevanceGate(double threshold) {
        this.threshold = threshold;
    }

    public RelevanceDecision evaluate(String userMessage, String assistantReply) {
        var user = userMessage == null ? "" : userMessage.strip().toLowerCase(Locale.ROOT);
        var reply = assistantReply == null ? "" : assistantReply;
        if (user.isEmpty()) return new RelevanceDecision(false, 0.0, Importance.LOW, "empty_message");

        for (var p : JUNK) {
            if (p.matcher(user).matches()) {
                return new RelevanceDecision(false, 0.1, Importance.LOW, "low_utility_phrase");
            }
        }
        if (user.length() < 10 && user.split("\\s+").length < 3) {
            return new RelevanceDecision(false, 0.2, Importance.LOW, "too_short");
        }

        var combined = userMessage + "\n" + reply;
        double score = 0.3;
        if (CODE_MARKERS.stream().anyMatch(combined::contains)) score += 0.3;
        if (KEYWORDS.stream().anyMatch(user::contains)) score += 0.3;
        if (user.length() > 50) score += 0.1;
        if (combined.length() > 150) score += 0.1;
        if (PERSONAL_FACTS.stream().anyMatch(user::contains)) score += 0.2;
        score = Math.min(1.0, score);

        if (score < threshold) return new RelevanceDecision(false, score, Importance.LOW, "below_threshold");
        var importance = score >= 0.9 ? Importance.HIGH : Importance.MEDIUM;
        return new RelevanceDecision(true, score, importance, "content_useful");
    }
}
