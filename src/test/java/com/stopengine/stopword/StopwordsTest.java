package com.stopengine.stopword;

import com.stopengine.error.StopwordConfigException;
import com.stopengine.error.UnknownResourceException;
import com.stopengine.resource.ResourceGraphResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StopwordsTest {

    @TempDir
    Path tempDir;

    private Stopwords stopwords;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("base.txt"), "# temel\nve\nama\nIRMAK\n");
        Files.writeString(tempDir.resolve("social.txt"), "rt\ndm\n");
        Path metadata = Files.writeString(tempDir.resolve("metadata.json"), """
            {"sets": {
              "base": {"file": "base.txt"},
              "social": {"extends": ["base"], "file": "social.txt"},
              "legacy/social": {"alias": "social"}
            }}
            """);
        stopwords = new Stopwords(new ResourceGraphResolver(), metadata, "base");
    }

    @Test
    @DisplayName("默认实例基于内置资源")
    void testDefaultInstance() {
        Stopwords defaults = Stopwords.defaultInstance();

        assertSame(defaults, Stopwords.defaultInstance());
        assertTrue(defaults.isStopword("ve"));
        assertFalse(defaults.isStopword("durak"));
        assertTrue(defaults.baseStopwords().containsAll(Set.of("ve", "ama", "çünkü", "öyle")));
        assertEquals(defaults.loadResource("domains/social_media"), defaults.loadResource("tr/domains/social_media"));
        assertEquals(List.of("Durak"), defaults.removeStopwords(List.of("ve", "Durak", "ama")));
    }

    @Test
    void testLoadResourceAndResources() {
        assertEquals(Set.of("ve", "ama", "ırmak"), stopwords.loadResource("base"));
        assertEquals(Set.of("ve", "ama", "IRMAK"), stopwords.loadResource("base", true));
        assertEquals(Set.of("ve", "ama", "ırmak", "rt", "dm"),
            stopwords.loadResources(List.of("base", "social"), false));
        assertEquals(stopwords.loadResource("social"), stopwords.loadResource("legacy/social"));
        assertEquals(stopwords.loadResource("base"), stopwords.baseStopwords());
    }

    @Test
    @DisplayName("isStopword: 默认资源与指定资源")
    void testIsStopword() {
        assertTrue(stopwords.isStopword("VE"));
        assertTrue(stopwords.isStopword("Irmak"));
        assertFalse(stopwords.isStopword("rt"));
        assertTrue(stopwords.isStopword("rt", List.of("social"), false));
        assertTrue(stopwords.isStopword("RT", List.of("legacy/social"), false));
        assertFalse(stopwords.isStopword("RT", List.of("social"), true));
        assertFalse(stopwords.isStopword(null));
        assertFalse(stopwords.isStopword(""));
    }

    @Test
    void testListStopwordsIsSorted() {
        List<String> words = stopwords.listStopwords();

        assertEquals(words.stream().sorted().toList(), words);
        assertEquals(Set.of("ve", "ama", "ırmak"), Set.copyOf(words));
        assertEquals(5, stopwords.listStopwords(List.of("social"), false, false).size());
    }

    @Test
    void testUnknownResourcePropagates() {
        UnknownResourceException exception = assertThrows(UnknownResourceException.class,
            () -> stopwords.listStopwords(List.of("ghost"), false, true));
        assertEquals("ghost", exception.getResourceName());
    }

    @Test
    @DisplayName("removeStopwords: 构造临时管理器过滤")
    void testRemoveStopwordsBuildsManager() {
        List<String> tokens = List.of("ve", "Durak", "ama", "rt", "güzel");

        assertEquals(List.of("Durak", "rt", "güzel"), stopwords.removeStopwords(tokens));
        assertEquals(List.of("Durak", "ama", "güzel"), stopwords.removeStopwords(tokens,
            FilterOptions.defaults().withAdditions(List.of("rt")).withKeep(List.of("ama"))));
        assertEquals(List.of("ve", "ama", "rt", "güzel"), stopwords.removeStopwords(tokens,
            FilterOptions.defaults().withBase(List.of("durak"))));
        assertEquals(List.of(), stopwords.removeStopwords(null));
    }

    @Test
    @DisplayName("removeStopwords: 使用已有管理器")
    void testRemoveStopwordsWithManager() {
        StopwordManager manager = new StopwordManager(List.of("güzel"), null, null, true);

        assertEquals(List.of("ve", "Güzel"),
            stopwords.removeStopwords(List.of("ve", "güzel", "Güzel"), FilterOptions.ofManager(manager)));
        assertEquals(List.of("ve"),
            stopwords.removeStopwords(List.of("ve", "güzel"), FilterOptions.ofManager(manager).withCaseSensitive(true)));
    }

    @Test
    @DisplayName("removeStopwords: 参数冲突报配置错误")
    void testRemoveStopwordsConfigErrors() {
        StopwordManager manager = new StopwordManager(List.of("ve"), null, null, false);
        List<String> tokens = List.of("ve");

        assertThrows(StopwordConfigException.class, () -> stopwords.removeStopwords(tokens,
            FilterOptions.ofManager(manager).withAdditions(List.of("x"))));
        assertThrows(StopwordConfigException.class, () -> stopwords.removeStopwords(tokens,
            FilterOptions.ofManager(manager).withBase(List.of("x"))));
        assertThrows(StopwordConfigException.class, () -> stopwords.removeStopwords(tokens,
            FilterOptions.ofManager(manager).withCaseSensitive(true)));
    }

    @Test
    @DisplayName("withMetadata 共享解析器缓存")
    void testWithMetadataSharesResolver() throws IOException {
        Path other = Files.createDirectories(tempDir.resolve("other"));
        Files.writeString(other.resolve("w.txt"), "madde\n");
        Path otherMetadata = Files.writeString(other.resolve("metadata.json"),
            "{\"sets\": {\"base\": {\"file\": \"w.txt\"}}}");

        Stopwords legal = stopwords.withMetadata(otherMetadata);

        assertSame(stopwords.getResolver(), legal.getResolver());
        assertEquals(Set.of("madde"), legal.baseStopwords());
        assertEquals(Set.of("ve", "ama", "ırmak"), stopwords.baseStopwords());
    }
}
