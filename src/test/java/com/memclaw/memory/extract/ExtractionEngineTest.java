package com.memclaw.memory.extract;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ExtractionEngineTest {

    private final ExtractionEngine engine = new ExtractionEngine();

    @Test
    void decisionAboutPostgresIsDatabaseTopicAndTechnologyEntity() {
        var text = "We decided to use PostgreSQL for the project";

        assertThat(engine.extractTopics(text)).contains("Database");
        assertEquals(List.of(new Entity("PostgreSQL", EntityType.TECHNOLOGY)), engine.extractEntities(text));
    }

    @Test
    void topicsAreCappedInTaxonomyOrder() {
        var topics = engine.extractTopics("docker kubernetes aws graphql database python java javascript");

        assertEquals(List.of("Docker", "Kubernetes", "Cloud"), topics);
    }

    @Test
    void compoundWordsBecomeTopicsAfterTaxonomyMatches() {
        var topics = engine.extractTopics("Refactoring the SyncWorker loop");

        assertEquals(List.of("Architecture", "SyncWorker"), topics);
    }

    @Test
    void compoundWordNamingATopicIsNotRepeated() {
        var topics = engine.extractTopics("JavaScript bundle size");

        assertEquals(List.of("Java", "JavaScript"), topics);
    }

    @Test
    void chineseTriggersMatch() {
        assertEquals(List.of("Database", "Performance"), engine.extractTopics("数据库索引优化"));
    }

    @Test
    void noTopicsForSmallTalk() {
        assertTrue(engine.extractTopics("Sunny weather expected for the weekend hike").isEmpty());
        assertTrue(engine.extractTopics("").isEmpty());
        assertTrue(engine.extractTopics(null).isEmpty());
    }

    @Test
    void allFourDetectorsContributeInOrder() {
        var wide = new ExtractionEngine(TopicTaxonomy.defaults(), 3, 5);

        var entities = wide.extractEntities("HybridMemoryStore reads config/app.yaml and MEMCLAW_DB_PATH with Redis");

        assertEquals(List.of(
                new Entity("Redis", EntityType.TECHNOLOGY),
                new Entity("HybridMemoryStore", EntityType.CLASS),
                new Entity("config/app.yaml", EntityType.FILE),
                new Entity("MEMCLAW_DB_PATH", EntityType.CONFIG)), entities);
    }

    @Test
    void entitiesAreCappedAtThreeByDefault() {
        var entities = engine.extractEntities("HybridMemoryStore reads config/app.yaml and MEMCLAW_DB_PATH with Redis");

        assertEquals(3, entities.size());
        assertEquals("Redis", entities.get(0).name());
    }

    @Test
    void technologyNamesNeedWordBoundaries() {
        assertTrue(engine.extractEntities("the dockerised build").isEmpty());
        assertEquals("Docker", engine.extractEntities("run it in Docker today").get(0).name());
    }

    @Test
    void rejectsNonPositiveCaps() {
        assertThrows(IllegalArgumentException.class, () -> new ExtractionEngine(TopicTaxonomy.defaults(), 0, 3));
    }

    @Test
    void filePathsKeepKnownExtensionAndDropSentencePunctuation() {
        assertEquals(List.of(new Entity("config/app.yaml", EntityType.FILE)),
                engine.extractEntities("the defaults live in config/app.yaml."));
        assertTrue(engine.extractEntities("read notes.javascript and build/out.bak").isEmpty());
    }

    @Test
    void oversizedTokensNeverBecomeNames() {
        var configKey = "A" + "_B".repeat(20_000);
        var compound = "Hybrid" + "Store".repeat(100);
        var text = "set " + configKey + " in " + compound + " and " + "x/".repeat(100) + "app.yaml";

        assertThat(engine.extractEntities(text))
                .allSatisfy(e -> assertThat(e.name().length()).isLessThanOrEqualTo(ExtractionEngine.MAX_NAME_LENGTH));
        assertThat(engine.extractTopics(text))
                .allSatisfy(t -> assertThat(t.length()).isLessThanOrEqualTo(ExtractionEngine.MAX_NAME_LENGTH));
    }

    @Test
    void longPathLikeInputIsScannedQuickly() {
        var text = "ab/".repeat(50_000);

        var entities = assertTimeout(Duration.ofSeconds(2), () -> engine.extractEntities(text));

        assertTrue(entities.isEmpty());
    }
}
